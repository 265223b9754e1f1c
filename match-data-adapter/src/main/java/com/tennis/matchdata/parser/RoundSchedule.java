package com.tennis.matchdata.parser;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Infers a date for every match from its tournament's start date.
 *
 * Results files only carry the tournament start, so a match is dated
 * {@code start + n} days where {@code n} is the position of its round among the
 * rounds that tournament actually played. Rounds not in {@link #ROUND_ORDER}
 * are placed after every known round.
 */
@Component
public class RoundSchedule {

    public static final List<String> ROUND_ORDER = List.of(
            "Q1", "Q2", "Q3", "Q4", "R128", "R64", "R32", "RR", "R16", "QF", "SF", "BR", "F"
    );

    public static int roundRank(String round) {
        int idx = round == null ? -1 : ROUND_ORDER.indexOf(round.trim().toUpperCase());
        return idx >= 0 ? idx : ROUND_ORDER.size();
    }

    /**
     * Dates for all rows, keyed by row identity.
     */
    public Map<ResultRow, LocalDate> inferDates(List<ResultRow> rows) {
        Map<TournamentKey, TreeSet<String>> roundsByTournament = new HashMap<>();
        for (ResultRow row : rows) {
            roundsByTournament
                    .computeIfAbsent(TournamentKey.of(row), k -> new TreeSet<>(ROUND_COMPARATOR))
                    .add(normalize(row.round()));
        }

        Map<ResultRow, LocalDate> dates = new HashMap<>();
        for (ResultRow row : rows) {
            TreeSet<String> played = roundsByTournament.get(TournamentKey.of(row));
            int offset = played.headSet(normalize(row.round())).size();
            dates.put(row, row.tourneyDate().plusDays(offset));
        }
        return dates;
    }

    private static final Comparator<String> ROUND_COMPARATOR =
            Comparator.comparingInt(RoundSchedule::roundRank).thenComparing(Comparator.naturalOrder());

    private static String normalize(String round) {
        return round == null ? "" : round.trim().toUpperCase();
    }

    private record TournamentKey(LocalDate start, String name) {
        static TournamentKey of(ResultRow row) {
            return new TournamentKey(row.tourneyDate(), row.tourneyName());
        }
    }
}
