package com.tennis.rating.model;

import java.util.List;

/**
 * Aggregate quality of the predictions made over the evaluation window.
 */
public record EvaluationReport(
        int totalMatches,
        int correct,
        double accuracy,
        double brierScore,
        double logLoss,
        List<CalibrationBucket> calibration,
        List<MatchPrediction> predictions
) {
    public EvaluationReport {
        calibration = List.copyOf(calibration);
        predictions = List.copyOf(predictions);
    }

    public String getAccuracyPercent() {
        return String.format("%.1f%%", accuracy * 100);
    }

    public String getBrierScoreFormatted() {
        return String.format("%.4f", brierScore);
    }
}
