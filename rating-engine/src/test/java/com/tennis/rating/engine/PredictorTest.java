package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PredictorTest {

    private final Predictor predictor = new Predictor(400.0);

    @Test
    void equalRatings_giveEvenOdds() {
        assertEquals(0.5, predictor.winProbability(1500, 1500), 1e-12);
    }

    @Test
    void fourHundredPointGap_givesTenToOne() {
        assertEquals(10.0 / 11.0, predictor.winProbability(1900, 1500), 1e-12);
    }

    @Test
    void bothOrientations_sumToOne() {
        double[][] pairs = {{1500, 1500}, {1620.5, 1490.2}, {1200, 2100}, {3000, 100}};
        for (double[] pair : pairs) {
            double sum = predictor.winProbability(pair[0], pair[1]) + predictor.winProbability(pair[1], pair[0]);
            assertEquals(1.0, sum, 1e-12);
        }
    }

    @Test
    void probability_increasesWithRatingDifference() {
        double previous = 0.0;
        for (int diff = -800; diff <= 800; diff += 50) {
            double p = predictor.winProbability(1500 + diff, 1500);
            assertTrue(p > previous, "not increasing at diff " + diff);
            previous = p;
        }
    }

    @Test
    void extremeGap_staysStrictlyInsideUnitInterval() {
        double high = predictor.winProbability(100_000, 0);
        double low = predictor.winProbability(0, 100_000);
        assertTrue(high < 1.0);
        assertTrue(low > 0.0);
    }

    @Test
    void nonPositiveScale_isRejected() {
        assertThrows(ConfigurationException.class, () -> new Predictor(0));
        assertThrows(ConfigurationException.class, () -> new Predictor(-400));
        assertThrows(ConfigurationException.class, () -> new Predictor(Double.NaN));
    }
}
