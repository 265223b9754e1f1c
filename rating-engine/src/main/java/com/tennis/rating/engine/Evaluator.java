package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.CalibrationBucket;
import com.tennis.rating.model.EvaluationReport;
import com.tennis.rating.model.Match;
import com.tennis.rating.model.MatchPrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays held-out matches, predicting each one before its result is folded in,
 * and scores the predictions.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final int bucketCount;

    public Evaluator(int bucketCount) {
        if (bucketCount < 1) {
            throw new ConfigurationException("calibration-buckets must be at least 1, got " + bucketCount);
        }
        this.bucketCount = bucketCount;
    }

    public EvaluationReport evaluate(List<Match> matches, RatingEngine engine) {
        List<MatchPrediction> predictions = new ArrayList<>(matches.size());
        for (Match match : matches) {
            predictions.add(engine.predict(match));
            engine.process(match);
        }
        EvaluationReport report = summarize(predictions);
        log.info("Evaluated {} matches: accuracy {}, Brier {}, log-loss {}",
                report.totalMatches(), report.getAccuracyPercent(), report.getBrierScoreFormatted(),
                String.format("%.4f", report.logLoss()));
        return report;
    }

    public EvaluationReport summarize(List<MatchPrediction> predictions) {
        int total = predictions.size();
        int correct = 0;
        double brierSum = 0.0;
        double logLossSum = 0.0;

        for (MatchPrediction p : predictions) {
            if (p.correct()) {
                correct++;
            }
            brierSum += p.brierScore();
            logLossSum -= Math.log(Math.max(Predictor.MIN_PROBABILITY, p.winnerProbability()));
        }

        double accuracy = total > 0 ? (double) correct / total : 0.0;
        double brier = total > 0 ? brierSum / total : 0.0;
        double logLoss = total > 0 ? logLossSum / total : 0.0;
        return new EvaluationReport(total, correct, accuracy, brier, logLoss, calibrate(predictions), predictions);
    }

    /**
     * Fixed-width buckets over player A's predicted probability, compared with how often A won.
     */
    public List<CalibrationBucket> calibrate(List<MatchPrediction> predictions) {
        int[] counts = new int[bucketCount];
        double[] predictedSums = new double[bucketCount];
        double[] outcomeSums = new double[bucketCount];

        for (MatchPrediction p : predictions) {
            int index = Math.min(bucketCount - 1, (int) (p.probabilityA() * bucketCount));
            counts[index]++;
            predictedSums[index] += p.probabilityA();
            outcomeSums[index] += p.outcomeA();
        }

        double width = 1.0 / bucketCount;
        List<CalibrationBucket> buckets = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            int n = counts[i];
            buckets.add(new CalibrationBucket(
                    i * width,
                    i == bucketCount - 1 ? 1.0 : (i + 1) * width,
                    n,
                    n > 0 ? predictedSums[i] / n : 0.0,
                    n > 0 ? outcomeSums[i] / n : 0.0
            ));
        }
        return buckets;
    }

    public int getBucketCount() { return bucketCount; }
}
