package com.tennis.rating.model;

/**
 * Rating movement produced by one match, seen from player A.
 */
public record RatingDelta(
        double expectedA,
        double actualA,
        double tierWeight,
        double marginMultiplier,
        double deltaA,
        double deltaB
) {
    public double surpriseA() {
        return actualA - expectedA;
    }

    public double surpriseB() {
        return -surpriseA();
    }

    public String getDeltaAFormatted() {
        return String.format("%+.1f", deltaA);
    }
}
