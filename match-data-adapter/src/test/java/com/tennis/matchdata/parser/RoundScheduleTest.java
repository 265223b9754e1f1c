package com.tennis.matchdata.parser;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RoundScheduleTest {

    private static final LocalDate START = LocalDate.of(2019, 6, 3);

    private final RoundSchedule schedule = new RoundSchedule();

    private static ResultRow row(String tournament, LocalDate start, String matchNum, String round) {
        return new ResultRow("t-" + tournament, tournament, "Grass", start, matchNum,
                "w" + matchNum, "W" + matchNum, "l" + matchNum, "L" + matchNum, "6-1 6-1", round, Map.of());
    }

    @Test
    void matches_areDatedByPositionAmongPlayedRounds() {
        ResultRow finalRow = row("Eastbourne", START, "1", "F");
        ResultRow semi = row("Eastbourne", START, "2", "SF");
        ResultRow quarter = row("Eastbourne", START, "3", "QF");
        ResultRow r32 = row("Eastbourne", START, "4", "R32");

        Map<ResultRow, LocalDate> dates = schedule.inferDates(List.of(finalRow, semi, quarter, r32));

        // R16 was not played, so the rounds are packed without a gap
        assertEquals(START, dates.get(r32));
        assertEquals(START.plusDays(1), dates.get(quarter));
        assertEquals(START.plusDays(2), dates.get(semi));
        assertEquals(START.plusDays(3), dates.get(finalRow));
    }

    @Test
    void tournaments_areScheduledIndependently() {
        ResultRow smallFinal = row("Nottingham", START, "1", "F");
        ResultRow bigFirst = row("Birmingham", START, "1", "R64");
        ResultRow bigFinal = row("Birmingham", START, "2", "F");

        Map<ResultRow, LocalDate> dates = schedule.inferDates(List.of(smallFinal, bigFirst, bigFinal));

        assertEquals(START, dates.get(smallFinal));
        assertEquals(START, dates.get(bigFirst));
        assertEquals(START.plusDays(1), dates.get(bigFinal));
    }

    @Test
    void qualifyingAndRoundRobin_followTheRoundOrder() {
        ResultRow q1 = row("Finals", START, "1", "Q1");
        ResultRow rr = row("Finals", START, "2", "RR");
        ResultRow sf = row("Finals", START, "3", "SF");

        Map<ResultRow, LocalDate> dates = schedule.inferDates(List.of(sf, rr, q1));

        assertEquals(START, dates.get(q1));
        assertEquals(START.plusDays(1), dates.get(rr));
        assertEquals(START.plusDays(2), dates.get(sf));
    }

    @Test
    void unknownRound_comesAfterKnownRounds() {
        assertTrue(RoundSchedule.roundRank("F") < RoundSchedule.roundRank("ER"));
        assertTrue(RoundSchedule.roundRank("RR") < RoundSchedule.roundRank("R16"));
        assertTrue(RoundSchedule.roundRank("R32") < RoundSchedule.roundRank("RR"));
    }
}
