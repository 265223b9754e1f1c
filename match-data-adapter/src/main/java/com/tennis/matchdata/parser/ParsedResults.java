package com.tennis.matchdata.parser;

import java.util.List;

/**
 * Rows read from one results file and how many lines could not be used.
 */
public record ParsedResults(
        List<ResultRow> rows,
        int skippedLines
) {
    public ParsedResults {
        rows = List.copyOf(rows);
    }
}
