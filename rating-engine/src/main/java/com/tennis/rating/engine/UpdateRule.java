package com.tennis.rating.engine;

import com.tennis.rating.model.Match;
import com.tennis.rating.model.RatingDelta;

/**
 * Elo-style rating movement for one match:
 * {@code delta_a = K_tier * M(score) * (S_a - E_a)} and {@code delta_b = -delta_a}.
 */
public class UpdateRule {

    private final Predictor predictor;
    private final TierWeights tierWeights;
    private final MarginFunction marginFunction;

    public UpdateRule(Predictor predictor, TierWeights tierWeights, MarginFunction marginFunction) {
        this.predictor = predictor;
        this.tierWeights = tierWeights;
        this.marginFunction = marginFunction;
    }

    /**
     * @param effectiveA pre-match effective rating of player A
     * @param effectiveB pre-match effective rating of player B
     */
    public RatingDelta compute(Match match, double effectiveA, double effectiveB) {
        double expectedA = predictor.winProbability(effectiveA, effectiveB);
        double actualA = match.playerAWon() ? 1.0 : 0.0;
        double k = tierWeights.weightFor(match.tier());
        double m = marginFunction.multiplier(match.score());

        double deltaA = k * m * (actualA - expectedA);
        return new RatingDelta(expectedA, actualA, k, m, deltaA, -deltaA);
    }
}
