package com.tennis.rating.model;

/**
 * Outcome of one full sweep: fit window, evaluation window and the snapshots taken along the way.
 */
public record RunResult(
        RunConfig config,
        int fitMatches,
        int excludedMatches,
        EvaluationReport evaluation,
        RatingSnapshot fitSnapshot,
        RatingSnapshot finalSnapshot,
        int dataQualityWarnings
) {}
