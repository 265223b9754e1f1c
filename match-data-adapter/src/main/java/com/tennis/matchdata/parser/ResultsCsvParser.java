package com.tennis.matchdata.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header-driven parser for yearly results files.
 */
@Component
public class ResultsCsvParser {

    private static final Logger log = LoggerFactory.getLogger(ResultsCsvParser.class);

    public static final List<String> REQUIRED_COLUMNS = List.of(
            "tourney_id", "tourney_name", "surface", "tourney_date", "match_num",
            "winner_id", "winner_name", "loser_id", "loser_name", "score", "round"
    );

    private static final DateTimeFormatter SOURCE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    /**
     * @throws IllegalArgumentException if the content is empty or a required column is missing
     */
    public ParsedResults parse(String content) {
        List<ResultRow> rows = new ArrayList<>();
        int skipped = 0;

        try (BufferedReader reader = new BufferedReader(new StringReader(content))) {
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                throw new IllegalArgumentException("Results file is empty");
            }

            String[] headers = parseLine(stripBom(headerLine));
            Map<String, Integer> columnIndex = new HashMap<>();
            for (int i = 0; i < headers.length; i++) {
                columnIndex.put(headers[i].trim().toLowerCase(), i);
            }
            validateRequiredColumns(columnIndex);

            String line;
            int lineNum = 1;
            while ((line = reader.readLine()) != null) {
                lineNum++;
                if (line.trim().isEmpty()) continue;

                ResultRow row = toRow(parseLine(line), headers, columnIndex);
                if (row == null) {
                    log.debug("Skipping line {}: no tournament date or players", lineNum);
                    skipped++;
                } else {
                    rows.add(row);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        if (skipped > 0) {
            log.warn("Skipped {} unusable lines", skipped);
        }
        log.debug("Parsed {} result rows", rows.size());
        return new ParsedResults(rows, skipped);
    }

    private ResultRow toRow(String[] values, String[] headers, Map<String, Integer> columnIndex) {
        LocalDate tourneyDate = parseDate(getColumn(values, columnIndex, "tourney_date"));
        ResultRow row = new ResultRow(
                getColumn(values, columnIndex, "tourney_id"),
                getColumn(values, columnIndex, "tourney_name"),
                getColumn(values, columnIndex, "surface"),
                tourneyDate,
                getColumn(values, columnIndex, "match_num"),
                getColumn(values, columnIndex, "winner_id"),
                getColumn(values, columnIndex, "winner_name"),
                getColumn(values, columnIndex, "loser_id"),
                getColumn(values, columnIndex, "loser_name"),
                getColumn(values, columnIndex, "score"),
                getColumn(values, columnIndex, "round"),
                rawColumns(values, headers)
        );
        if (tourneyDate == null || row.winnerKey() == null || row.loserKey() == null) {
            return null;
        }
        return row;
    }

    private void validateRequiredColumns(Map<String, Integer> columnIndex) {
        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(c -> !columnIndex.containsKey(c))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Results file is missing required columns: " + missing);
        }
    }

    private String getColumn(String[] values, Map<String, Integer> columnIndex, String column) {
        Integer idx = columnIndex.get(column);
        if (idx == null || idx >= values.length) {
            return null;
        }
        String value = values[idx].trim();
        return value.isEmpty() ? null : value;
    }

    private Map<String, String> rawColumns(String[] values, String[] headers) {
        Map<String, String> raw = new LinkedHashMap<>();
        for (int i = 0; i < headers.length && i < values.length; i++) {
            if (!values[i].isEmpty()) {
                raw.put(headers[i].trim(), values[i]);
            }
        }
        return raw;
    }

    private LocalDate parseDate(String value) {
        if (value == null) return null;
        try {
            // some exports write the yyyyMMdd value as a float
            String digits = value.endsWith(".0") ? value.substring(0, value.length() - 2) : value;
            return LocalDate.parse(digits, SOURCE_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    /**
     * Split a CSV line, honouring double quotes and escaped quotes inside them.
     */
    static String[] parseLine(String line) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                values.add(current.toString());
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        values.add(current.toString());

        return values.toArray(new String[0]);
    }
}
