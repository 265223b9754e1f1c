package com.tennis.rating.model;

import java.time.LocalDate;

/**
 * Immutable copy of one player's rating fields inside a {@link RatingSnapshot}.
 */
public record PlayerRating(
        int rank,
        String playerId,
        double effectiveRating,
        double baselineRating,
        double currentRating,
        double formSignal,
        LocalDate lastActiveDate,
        int matchesPlayed,
        int wins,
        int losses,
        double peakRating,
        LocalDate peakDate
) {
    public String getEffectiveRatingFormatted() {
        return String.format("%.1f", effectiveRating);
    }

    public String getFormFormatted() {
        return String.format("%+.3f", formSignal);
    }
}
