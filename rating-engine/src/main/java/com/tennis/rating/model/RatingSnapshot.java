package com.tennis.rating.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Ranked, immutable view of every player's ratings as of a date.
 */
public record RatingSnapshot(
        LocalDate asOf,
        List<PlayerRating> ratings
) {
    public RatingSnapshot {
        ratings = List.copyOf(ratings);
    }

    public Optional<PlayerRating> find(String playerId) {
        return ratings.stream().filter(r -> r.playerId().equals(playerId)).findFirst();
    }

    public int size() {
        return ratings.size();
    }
}
