package com.tennis.matchdata.parser;

/**
 * Games and sets won by each side, as read from a score string.
 */
public record ParsedScore(
        int winnerGames,
        int winnerSets,
        int loserGames,
        int loserSets
) {}
