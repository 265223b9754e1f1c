package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;

/**
 * Logistic (base 10) link from a rating difference to a win probability.
 */
public class Predictor {

    /**
     * Keeps every probability strictly inside (0, 1), including for extreme rating gaps.
     */
    public static final double MIN_PROBABILITY = 1e-9;

    private final double scale;

    public Predictor(double scale) {
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new ConfigurationException("Rating scale must be a positive finite number, got " + scale);
        }
        this.scale = scale;
    }

    /**
     * Probability that a player rated {@code ratingA} beats a player rated {@code ratingB}.
     */
    public double winProbability(double ratingA, double ratingB) {
        double diff = ratingA - ratingB;
        // evaluate on the favourite's side so both orientations sum to one
        double p = diff >= 0
                ? favouriteProbability(diff)
                : 1.0 - favouriteProbability(-diff);
        return Math.max(MIN_PROBABILITY, Math.min(1.0 - MIN_PROBABILITY, p));
    }

    private double favouriteProbability(double diff) {
        return 1.0 / (1.0 + Math.pow(10, -diff / scale));
    }

    public double getScale() { return scale; }
}
