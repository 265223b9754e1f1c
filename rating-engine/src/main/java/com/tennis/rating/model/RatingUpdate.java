package com.tennis.rating.model;

/**
 * Everything needed to move both players of one match to their post-match state.
 *
 * The full delta goes to the current ratings, the baseline deltas are the share of it
 * that reaches the long-run ratings.
 */
public record RatingUpdate(
        RatingDelta delta,
        double baselineDeltaA,
        double baselineDeltaB,
        double formA,
        double formB
) {}
