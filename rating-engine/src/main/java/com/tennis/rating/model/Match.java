package com.tennis.rating.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A normalized, immutable match record as supplied by the match feed.
 *
 * @param score   null when the source had no usable score
 * @param surface null when unknown
 */
public record Match(
        String matchKey,
        LocalDate date,
        String playerA,
        String playerB,
        String winner,
        Score score,
        Tier tier,
        Surface surface
) {
    public Match {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(playerA, "playerA");
        Objects.requireNonNull(playerB, "playerB");
        Objects.requireNonNull(winner, "winner");
        Objects.requireNonNull(tier, "tier");
        if (playerA.equals(playerB)) {
            throw new IllegalArgumentException("Match " + matchKey + " has the same player on both sides: " + playerA);
        }
        if (!winner.equals(playerA) && !winner.equals(playerB)) {
            throw new IllegalArgumentException("Winner " + winner + " did not play match " + matchKey);
        }
    }

    public boolean playerAWon() {
        return winner.equals(playerA);
    }

    public String loser() {
        return playerAWon() ? playerB : playerA;
    }

    public int year() {
        return date.getYear();
    }
}
