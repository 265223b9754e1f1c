package com.tennis.rating.export;

import com.tennis.rating.model.RunResult;

import java.util.Map;

/**
 * Publishes the outcome of a rating run: final rankings, evaluation metrics and per-match predictions.
 */
public interface RankingsExporter {

    /**
     * @param playerNames display names keyed by player id; ids without a name are exported as-is
     */
    void export(String runId, RunResult result, Map<String, String> playerNames);
}
