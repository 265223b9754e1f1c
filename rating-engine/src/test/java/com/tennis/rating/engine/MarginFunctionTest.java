package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.Score;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarginFunctionTest {

    private final MarginFunction margin = new MarginFunction(1.5, 8.0, 2.0);

    @Test
    void narrowestWin_isNeutral() {
        // 4-6 7-6 7-6
        Score narrow = new Score(18, 2, 18, 1);
        assertEquals(1.0, margin.multiplier(narrow), 1e-12);
    }

    @Test
    void missingOrInconsistentScore_isNeutral() {
        assertEquals(MarginFunction.NEUTRAL, margin.multiplier(null));
        assertEquals(MarginFunction.NEUTRAL, margin.multiplier(new Score(10, 1, 12, 2)));
    }

    @Test
    void widerMargins_neverDecreaseMultiplier() {
        Score[] increasing = {
                new Score(18, 2, 18, 1),   // 4-6 7-6 7-6
                new Score(19, 2, 16, 1),   // 6-4 6-7 7-5
                new Score(13, 2, 11, 0),   // 7-6 6-5
                new Score(12, 2, 6, 0),    // 6-3 6-3
                new Score(12, 2, 0, 0)     // 6-0 6-0
        };
        double previous = 0.0;
        for (Score score : increasing) {
            double m = margin.multiplier(score);
            assertTrue(m >= previous, "decreased at " + score.getFormatted());
            previous = m;
        }
        assertTrue(margin.multiplier(new Score(12, 2, 0, 0)) > 1.0);
    }

    @Test
    void multiplier_isBoundedByMaximum() {
        assertTrue(margin.multiplier(new Score(18, 3, 0, 0)) < 1.5);
        assertTrue(margin.multiplierForUnits(10_000) <= 1.5);
    }

    @Test
    void invalidTunables_areRejected() {
        assertThrows(ConfigurationException.class, () -> new MarginFunction(0.9, 8, 2));
        assertThrows(ConfigurationException.class, () -> new MarginFunction(1.5, 0, 2));
        assertThrows(ConfigurationException.class, () -> new MarginFunction(1.5, 8, -1));
    }
}
