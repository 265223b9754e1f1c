package com.tennis.rating.feed;

import com.tennis.rating.model.Match;

import java.util.List;
import java.util.Map;

/**
 * Matches loaded from a feed, the display names of their players and how many
 * records were unusable.
 */
public record MatchFeedResult(
        List<Match> matches,
        Map<String, String> playerNames,
        int skippedRecords
) {
    public MatchFeedResult {
        matches = List.copyOf(matches);
        playerNames = Map.copyOf(playerNames);
    }

    public String nameOf(String playerId) {
        return playerNames.getOrDefault(playerId, playerId);
    }
}
