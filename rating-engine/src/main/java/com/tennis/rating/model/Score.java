package com.tennis.rating.model;

/**
 * Games and sets won by each side of a completed match.
 */
public record Score(
        int winnerGames,
        int winnerSets,
        int loserGames,
        int loserSets
) {
    public int gameMargin() {
        return winnerGames - loserGames;
    }

    public boolean straightSets() {
        return loserSets == 0 && winnerSets > 0;
    }

    /**
     * A recorded score is usable for margin weighting only if the winner took more sets.
     */
    public boolean isConsistent() {
        return winnerGames >= 0 && loserGames >= 0 && winnerSets > loserSets && loserSets >= 0;
    }

    public String getFormatted() {
        return String.format("%d-%d sets, %d-%d games", winnerSets, loserSets, winnerGames, loserGames);
    }
}
