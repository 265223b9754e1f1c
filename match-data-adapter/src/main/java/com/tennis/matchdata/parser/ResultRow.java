package com.tennis.matchdata.parser;

import java.time.LocalDate;
import java.util.Map;

/**
 * One match line of a results file, with the raw columns kept alongside.
 */
public record ResultRow(
        String tourneyId,
        String tourneyName,
        String surface,
        LocalDate tourneyDate,
        String matchNum,
        String winnerId,
        String winnerName,
        String loserId,
        String loserName,
        String score,
        String round,
        Map<String, String> columns
) {
    public ResultRow {
        columns = Map.copyOf(columns);
    }

    /**
     * Player identity: the source id when present, otherwise the name.
     */
    public String winnerKey() {
        return identity(winnerId, winnerName);
    }

    public String loserKey() {
        return identity(loserId, loserName);
    }

    private static String identity(String id, String name) {
        if (id != null && !id.isBlank()) {
            return id.trim();
        }
        return name != null && !name.isBlank() ? name.trim() : null;
    }
}
