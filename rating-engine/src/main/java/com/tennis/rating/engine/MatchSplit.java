package com.tennis.rating.engine;

import com.tennis.rating.model.Match;

import java.util.List;

/**
 * Matches of a run partitioned into the fit window and the held-out evaluation window.
 */
public record MatchSplit(
        List<Match> fitMatches,
        List<Match> evaluationMatches,
        int excludedMatches
) {
    public MatchSplit {
        fitMatches = List.copyOf(fitMatches);
        evaluationMatches = List.copyOf(evaluationMatches);
    }
}
