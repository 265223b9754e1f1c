package com.tennis.rating.engine;

/**
 * The validated, immutable set of rating components and tunables shared by every run.
 */
public record RatingModel(
        double defaultRating,
        Predictor predictor,
        Blender blender,
        FormTracker formTracker,
        MarginFunction marginFunction,
        TierWeights tierWeights
) {
    public UpdateRule updateRule() {
        return new UpdateRule(predictor, tierWeights, marginFunction);
    }

    /**
     * A fresh engine with an empty rating store.
     */
    public RatingEngine newEngine() {
        return new RatingEngine(this, new RatingStore(defaultRating));
    }
}
