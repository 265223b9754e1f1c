package com.tennis.rating.engine;

import com.tennis.rating.model.Match;
import com.tennis.rating.model.Score;
import com.tennis.rating.model.Surface;
import com.tennis.rating.model.Tier;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default model and match builders shared by engine tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Map<Tier, Double> defaultWeights() {
        Map<Tier, Double> weights = new EnumMap<>(Tier.class);
        weights.put(Tier.ITF, 24.0);
        weights.put(Tier.TOUR, 32.0);
        return weights;
    }

    public static RatingModel model() {
        return model(defaultWeights());
    }

    public static RatingModel model(Map<Tier, Double> weights) {
        return new RatingModel(
                1500.0,
                new Predictor(400.0),
                new Blender(0.6, 0.1, 400.0, 0.1),
                new FormTracker(30.0, 0.2),
                new MarginFunction(1.5, 8.0, 2.0),
                new TierWeights(weights)
        );
    }

    public static Match match(String key, LocalDate date, String a, String b, String winner, Tier tier, Score score) {
        return new Match(key, date, a, b, winner, score, tier, Surface.HARD);
    }

    /**
     * Tour match without a score, so the margin multiplier is neutral.
     */
    public static Match tourMatch(String key, LocalDate date, String a, String b, String winner) {
        return match(key, date, a, b, winner, Tier.TOUR, null);
    }
}
