package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;

/**
 * Combines long-run ability, recent ability and form into the rating used for prediction:
 * {@code baseline + currentWeight * (current - baseline) + formWeight * form * formScale}.
 *
 * Also decides how much of each match delta reaches the baseline.
 */
public class Blender {

    private final double currentWeight;
    private final double formWeight;
    private final double formScale;
    private final double baselineShare;

    public Blender(double currentWeight, double formWeight, double formScale, double baselineShare) {
        requireUnitInterval("blend.current-weight", currentWeight);
        requireUnitInterval("blend.baseline-share", baselineShare);
        if (!(formWeight >= 0) || Double.isInfinite(formWeight)) {
            throw new ConfigurationException("blend.form-weight must be a non-negative number, got " + formWeight);
        }
        if (!(formScale >= 0) || Double.isInfinite(formScale)) {
            throw new ConfigurationException("form.scale must be a non-negative number, got " + formScale);
        }
        this.currentWeight = currentWeight;
        this.formWeight = formWeight;
        this.formScale = formScale;
        this.baselineShare = baselineShare;
    }

    public double effectiveRating(double baselineRating, double currentRating, double formSignal) {
        return baselineRating
                + currentWeight * (currentRating - baselineRating)
                + formWeight * formSignal * formScale;
    }

    /**
     * Portion of a match delta applied to the baseline rating.
     */
    public double baselineDelta(double delta) {
        return baselineShare * delta;
    }

    private static void requireUnitInterval(String name, double value) {
        if (!(value >= 0 && value <= 1)) {
            throw new ConfigurationException(name + " must be within [0, 1], got " + value);
        }
    }

    public double getCurrentWeight() { return currentWeight; }

    public double getFormWeight() { return formWeight; }

    public double getFormScale() { return formScale; }

    public double getBaselineShare() { return baselineShare; }
}
