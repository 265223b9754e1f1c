package com.tennis.rating.model;

import java.time.LocalDate;

/**
 * Pre-match prediction recorded for an evaluation-window match.
 *
 * @param probabilityA      probability that player A wins
 * @param winnerProbability probability assigned to the player who actually won
 */
public record MatchPrediction(
        String matchKey,
        LocalDate date,
        String playerA,
        String playerB,
        String winner,
        Tier tier,
        double effectiveRatingA,
        double effectiveRatingB,
        double probabilityA,
        double winnerProbability
) {
    public boolean correct() {
        return winnerProbability >= 0.5;
    }

    public double outcomeA() {
        return winner.equals(playerA) ? 1.0 : 0.0;
    }

    public String predictedWinner() {
        return probabilityA >= 0.5 ? playerA : playerB;
    }

    public double brierScore() {
        return Math.pow(probabilityA - outcomeA(), 2);
    }
}
