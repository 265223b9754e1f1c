package com.tennis.rating.model;

/**
 * Agreement between predicted and observed win frequency for one probability range.
 */
public record CalibrationBucket(
        double lower,
        double upper,
        int count,
        double meanPredicted,
        double observedFrequency
) {
    public String getRange() {
        return String.format("%.1f-%.1f", lower, upper);
    }
}
