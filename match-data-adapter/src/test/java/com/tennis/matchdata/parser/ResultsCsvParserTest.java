package com.tennis.matchdata.parser;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ResultsCsvParserTest {

    private static final String HEADER =
            "tourney_id,tourney_name,surface,draw_size,tourney_level,tourney_date,match_num,"
                    + "winner_id,winner_seed,winner_name,loser_id,loser_seed,loser_name,score,best_of,round";

    private final ResultsCsvParser parser = new ResultsCsvParser();

    @Test
    void rows_areReadByHeaderName() {
        String csv = HEADER + "\n"
                + "2019-0304,Brisbane,Hard,32,P,20181231,300,201594,1,Naomi Osaka,202458,,Lesia Tsurenko,6-2 6-4,3,QF\n";

        ParsedResults parsed = parser.parse(csv);

        assertEquals(1, parsed.rows().size());
        ResultRow row = parsed.rows().get(0);
        assertEquals("2019-0304", row.tourneyId());
        assertEquals(LocalDate.of(2018, 12, 31), row.tourneyDate());
        assertEquals("201594", row.winnerKey());
        assertEquals("Lesia Tsurenko", row.loserName());
        assertEquals("6-2 6-4", row.score());
        assertEquals("QF", row.round());
        assertEquals("P", row.columns().get("tourney_level"));
        assertEquals(0, parsed.skippedLines());
    }

    @Test
    void quotedFields_mayContainCommas() {
        String csv = HEADER + "\r\n"
                + "2019-1,\"Charleston, SC\",Clay,56,P,20190401,1,1,,\"Smith, \"\"Jo\"\"\",2,,Doe,6-1 6-1,3,R64\r\n";

        ResultRow row = parser.parse(csv).rows().get(0);

        assertEquals("Charleston, SC", row.tourneyName());
        assertEquals("Smith, \"Jo\"", row.winnerName());
        assertEquals("R64", row.round());
    }

    @Test
    void missingPlayerId_fallsBackToName() {
        String csv = HEADER + "\n"
                + "2019-2,Cairo,Clay,32,15,20190107,5,,,Anna Example,,,Beth Sample,6-4 6-4,3,R32\n";

        ResultRow row = parser.parse(csv).rows().get(0);

        assertEquals("Anna Example", row.winnerKey());
        assertEquals("Beth Sample", row.loserKey());
    }

    @Test
    void unusableLines_areSkipped() {
        String csv = HEADER + "\n"
                + "2019-2,Cairo,Clay,32,15,notadate,5,1,,A,2,,B,6-4 6-4,3,R32\n"
                + "2019-2,Cairo,Clay,32,15,20190107,6,,,,3,,C,6-4 6-4,3,R32\n"
                + "\n"
                + "2019-2,Cairo,Clay,32,15,20190107.0,7,4,,D,5,,E,6-4 6-4,3,R32\n";

        ParsedResults parsed = parser.parse(csv);

        assertEquals(1, parsed.rows().size());
        assertEquals("4", parsed.rows().get(0).winnerKey());
        assertEquals(2, parsed.skippedLines());
    }

    @Test
    void missingRequiredColumn_isRejected() {
        String csv = "tourney_id,tourney_name,surface,tourney_date,match_num,winner_id,winner_name,loser_id,loser_name,score\n";

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parser.parse(csv));
        assertTrue(e.getMessage().contains("round"));
    }

    @Test
    void emptyFile_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(""));
    }
}
