package com.tennis.rating.model;

/**
 * Playing surface. Carried on matches for reporting only; ratings are surface independent.
 */
public enum Surface {
    HARD,
    CLAY,
    GRASS,
    CARPET;

    public static Surface fromName(String name) {
        if (name == null || name.isBlank()) return null;
        try {
            return Surface.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
