package com.tennis.matchdata.model;

/**
 * Result object for ingestion operations.
 * Encapsulates success/failure state with error details.
 */
public class IngestionResult {

    private final boolean success;
    private final int count;
    private final int skipped;
    private final String message;
    private final String errorType;

    private IngestionResult(boolean success, int count, int skipped, String message, String errorType) {
        this.success = success;
        this.count = count;
        this.skipped = skipped;
        this.message = message;
        this.errorType = errorType;
    }

    public static IngestionResult success(int count, int skipped, String message) {
        return new IngestionResult(true, count, skipped, message, null);
    }

    public static IngestionResult partialSuccess(int count, int skipped, String message) {
        return new IngestionResult(true, count, skipped, message, "PARTIAL_SUCCESS");
    }

    public static IngestionResult failure(String message, String errorType) {
        return new IngestionResult(false, 0, 0, message, errorType);
    }

    public static IngestionResult failure(String message) {
        return new IngestionResult(false, 0, 0, message, "UNKNOWN");
    }

    public static IngestionResult sourceError(int statusCode, String details) {
        String msg = "Results source returned " + statusCode + " error";
        if (details != null && !details.isEmpty()) {
            msg += ": " + details;
        }
        return new IngestionResult(false, 0, 0, msg, "SOURCE_ERROR_" + statusCode);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isPartial() {
        return "PARTIAL_SUCCESS".equals(errorType);
    }

    public int getCount() {
        return count;
    }

    public int getSkipped() {
        return skipped;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorType() {
        return errorType;
    }
}
