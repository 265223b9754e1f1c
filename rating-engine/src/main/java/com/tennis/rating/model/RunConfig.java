package com.tennis.rating.model;

/**
 * Year range and held-out size of one rating run.
 */
public record RunConfig(
        int yearFrom,
        int yearTo,
        int testSizeYears
) {
    public int evaluationStartYear() {
        return yearTo - testSizeYears;
    }
}
