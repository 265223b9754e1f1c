package com.tennis.rating.engine;

import com.tennis.rating.model.Match;
import com.tennis.rating.model.Player;
import com.tennis.rating.model.PlayerRating;
import com.tennis.rating.model.RatingDelta;
import com.tennis.rating.model.RatingSnapshot;
import com.tennis.rating.model.RatingUpdate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rating state of every player seen so far in one run.
 *
 * Owned by a single sweep and written by it alone; not thread-safe.
 */
public class RatingStore {

    private final double defaultRating;
    private final Map<String, Player> players = new LinkedHashMap<>();

    public RatingStore(double defaultRating) {
        this.defaultRating = defaultRating;
    }

    /**
     * Get a player's state, registering the player with the default rating on first appearance.
     */
    public Player get(String playerId) {
        return players.computeIfAbsent(playerId, id -> new Player(id, defaultRating));
    }

    public Optional<Player> find(String playerId) {
        return Optional.ofNullable(players.get(playerId));
    }

    public Collection<Player> players() {
        return Collections.unmodifiableCollection(players.values());
    }

    public int size() {
        return players.size();
    }

    public double getDefaultRating() { return defaultRating; }

    /**
     * Move both participants of {@code match} to their post-match state.
     *
     * Every new value is computed and checked before the first write, so a rejected
     * update leaves both players untouched.
     *
     * @throws IllegalStateException if the match predates a participant's last match
     *                               or the update is not finite
     */
    public void apply(Match match, RatingUpdate update) {
        Player a = get(match.playerA());
        Player b = get(match.playerB());
        requireChronological(a, match);
        requireChronological(b, match);

        RatingDelta delta = update.delta();
        double currentA = a.getCurrentRating() + delta.deltaA();
        double currentB = b.getCurrentRating() + delta.deltaB();
        double baselineA = a.getBaselineRating() + update.baselineDeltaA();
        double baselineB = b.getBaselineRating() + update.baselineDeltaB();

        requireFinite(match, currentA, currentB, baselineA, baselineB, update.formA(), update.formB());

        boolean aWon = match.playerAWon();
        a.applyResult(baselineA, currentA, update.formA(), match.date(), aWon);
        b.applyResult(baselineB, currentB, update.formB(), match.date(), !aWon);
    }

    /**
     * Immutable ranking of all players by effective rating as of {@code asOf}, highest first,
     * ties broken by player id. Form is reported decayed to the snapshot date.
     */
    public RatingSnapshot snapshot(LocalDate asOf, Blender blender, FormTracker formTracker) {
        Map<String, Double> forms = new HashMap<>();
        Map<String, Double> effective = new HashMap<>();
        for (Player p : players.values()) {
            double form = formTracker.formAsOf(p, asOf);
            forms.put(p.getId(), form);
            effective.put(p.getId(), blender.effectiveRating(p.getBaselineRating(), p.getCurrentRating(), form));
        }

        List<Player> ordered = new ArrayList<>(players.values());
        ordered.sort(Comparator.comparingDouble((Player p) -> effective.get(p.getId())).reversed()
                .thenComparing(Player::getId));

        List<PlayerRating> ratings = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Player p = ordered.get(i);
            ratings.add(new PlayerRating(
                    i + 1,
                    p.getId(),
                    effective.get(p.getId()),
                    p.getBaselineRating(),
                    p.getCurrentRating(),
                    forms.get(p.getId()),
                    p.getLastActiveDate(),
                    p.getMatchesPlayed(),
                    p.getWins(),
                    p.getLosses(),
                    p.getPeakRating(),
                    p.getPeakDate()
            ));
        }
        return new RatingSnapshot(asOf, ratings);
    }

    private static void requireChronological(Player player, Match match) {
        LocalDate last = player.getLastActiveDate();
        if (last != null && match.date().isBefore(last)) {
            throw new IllegalStateException(String.format(
                    "Match %s on %s predates %s's last match on %s",
                    match.matchKey(), match.date(), player.getId(), last));
        }
    }

    private static void requireFinite(Match match, double... values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalStateException("Non-finite rating update for match " + match.matchKey());
            }
        }
    }
}
