package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.CalibrationBucket;
import com.tennis.rating.model.EvaluationReport;
import com.tennis.rating.model.Match;
import com.tennis.rating.model.MatchPrediction;
import com.tennis.rating.model.Tier;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest {

    private static final LocalDate DAY = LocalDate.of(2019, 5, 20);

    private final Evaluator evaluator = new Evaluator(10);

    private static MatchPrediction prediction(double probabilityA, boolean aWon) {
        return new MatchPrediction("m", DAY, "a", "b", aWon ? "a" : "b", Tier.TOUR,
                1500, 1500, probabilityA, aWon ? probabilityA : 1 - probabilityA);
    }

    @Test
    void summarize_computesAccuracyBrierAndLogLoss() {
        List<MatchPrediction> predictions = List.of(prediction(0.8, true), prediction(0.3, true));

        EvaluationReport report = evaluator.summarize(predictions);

        assertEquals(2, report.totalMatches());
        assertEquals(1, report.correct());
        assertEquals(0.5, report.accuracy(), 1e-12);
        assertEquals((0.04 + 0.49) / 2, report.brierScore(), 1e-12);
        assertEquals(-(Math.log(0.8) + Math.log(0.3)) / 2, report.logLoss(), 1e-12);
    }

    @Test
    void evenPrediction_countsAsCorrect() {
        EvaluationReport report = evaluator.summarize(List.of(prediction(0.5, false)));
        assertEquals(1.0, report.accuracy());
    }

    @Test
    void calibration_bucketsPlayerAProbability() {
        List<MatchPrediction> predictions = List.of(
                prediction(0.82, true), prediction(0.88, false), prediction(0.31, true), prediction(1.0 - 1e-9, true));

        List<CalibrationBucket> buckets = evaluator.summarize(predictions).calibration();

        assertEquals(10, buckets.size());
        CalibrationBucket eighties = buckets.get(8);
        assertEquals(2, eighties.count());
        assertEquals(0.85, eighties.meanPredicted(), 1e-12);
        assertEquals(0.5, eighties.observedFrequency(), 1e-12);
        assertEquals(1, buckets.get(3).count());
        assertEquals(1, buckets.get(9).count());
        assertEquals(0, buckets.get(0).count());
        assertEquals(1.0, buckets.get(9).upper());
    }

    @Test
    void emptyWindow_givesZeroedReport() {
        EvaluationReport report = evaluator.evaluate(List.of(), Fixtures.model().newEngine());

        assertEquals(0, report.totalMatches());
        assertEquals(0.0, report.accuracy());
        assertEquals(0.0, report.brierScore());
        assertEquals(0.0, report.logLoss());
        assertTrue(report.calibration().stream().allMatch(b -> b.count() == 0));
    }

    @Test
    void evaluate_predictsBeforeFoldingInEachResult() {
        RatingEngine engine = Fixtures.model().newEngine();
        List<Match> matches = List.of(
                Fixtures.tourMatch("m1", DAY, "a", "b", "a"),
                Fixtures.tourMatch("m2", DAY.plusDays(1), "a", "b", "a"));

        EvaluationReport report = evaluator.evaluate(matches, engine);

        assertEquals(0.5, report.predictions().get(0).probabilityA(), 1e-12);
        assertTrue(report.predictions().get(1).probabilityA() > 0.5);
        assertEquals(2, engine.getProcessedMatches());
    }

    @Test
    void zeroBuckets_isRejected() {
        assertThrows(ConfigurationException.class, () -> new Evaluator(0));
    }
}
