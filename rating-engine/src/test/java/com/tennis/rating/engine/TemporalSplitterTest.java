package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.Match;
import com.tennis.rating.model.RunConfig;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemporalSplitterTest {

    private final TemporalSplitter splitter = new TemporalSplitter();

    private static Match inYear(String key, int year, int dayOfYear) {
        return Fixtures.tourMatch(key, LocalDate.ofYearDay(year, dayOfYear), "a", "b", "a");
    }

    @Test
    void decadeWithTwoTestYears_splitsAtEvaluationStart() {
        List<Match> matches = List.of(
                inYear("2020-late", 2020, 300),
                inYear("2009", 2009, 200),
                inYear("2010", 2010, 1),
                inYear("2017", 2017, 365),
                inYear("2018", 2018, 1),
                inYear("2021", 2021, 5)
        );

        MatchSplit split = splitter.split(new RunConfig(2010, 2020, 2), matches);

        assertEquals(List.of("2010", "2017"), split.fitMatches().stream().map(Match::matchKey).toList());
        assertEquals(List.of("2018", "2020-late"), split.evaluationMatches().stream().map(Match::matchKey).toList());
        assertEquals(2, split.excludedMatches());
    }

    @Test
    void windows_areOrderedByDate() {
        List<Match> shuffled = List.of(inYear("c", 2012, 90), inYear("a", 2011, 10), inYear("b", 2011, 11));

        MatchSplit split = splitter.split(new RunConfig(2011, 2013, 1), shuffled);

        assertEquals(List.of("a", "b"), split.fitMatches().stream().map(Match::matchKey).toList());
        assertEquals(List.of("c"), split.evaluationMatches().stream().map(Match::matchKey).toList());
    }

    @Test
    void testSizeCoveringWholeRange_isConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> splitter.split(new RunConfig(2010, 2020, 12), List.of()));
        assertThrows(ConfigurationException.class,
                () -> splitter.validate(new RunConfig(2010, 2020, 10)));
    }

    @Test
    void invalidRangeOrTestSize_isConfigurationError() {
        assertThrows(ConfigurationException.class, () -> splitter.validate(new RunConfig(2020, 2010, 2)));
        assertThrows(ConfigurationException.class, () -> splitter.validate(new RunConfig(2015, 2015, 1)));
        assertThrows(ConfigurationException.class, () -> splitter.validate(new RunConfig(2010, 2020, 0)));
    }

    @Test
    void earlyStartYear_isAllowed() {
        assertDoesNotThrow(() -> splitter.validate(new RunConfig(2005, 2020, 2)));
    }
}
