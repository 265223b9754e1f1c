package com.tennis.rating.model;

import com.tennis.rating.exception.ConfigurationException;

import java.util.Arrays;

/**
 * Governing circuit of a match.
 *
 * Rating confidence per tier lives in the configured weight table, never in code
 * branching on the constant, so a new circuit only needs a constant and a weight.
 */
public enum Tier {

    ITF("I", "Lower-tier ITF circuit"),
    TOUR("W", "Top-tier tour");

    private final String sourceCode;
    private final String description;

    Tier(String sourceCode, String description) {
        this.sourceCode = sourceCode;
        this.description = description;
    }

    public String getSourceCode() { return sourceCode; }

    public String getDescription() { return description; }

    /**
     * Resolve a stored tier value, accepting either the enum name or the source code.
     *
     * @throws ConfigurationException if the value names no known tier
     */
    public static Tier fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ConfigurationException("Match record has no tier");
        }
        String trimmed = code.trim();
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(trimmed) || t.sourceCode.equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException("Unknown tier: " + trimmed));
    }
}
