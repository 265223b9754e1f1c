package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.Score;

/**
 * Score-margin multiplier. Exactly 1.0 for the narrowest win, increasing with the game
 * differential (plus a bonus for straight sets) and bounded by {@code maxMultiplier}.
 */
public class MarginFunction {

    public static final double NEUTRAL = 1.0;

    private final double maxMultiplier;
    private final double scale;
    private final double straightSetsBonus;

    public MarginFunction(double maxMultiplier, double scale, double straightSetsBonus) {
        if (!(maxMultiplier >= NEUTRAL) || Double.isInfinite(maxMultiplier)) {
            throw new ConfigurationException("margin.max-multiplier must be >= 1.0, got " + maxMultiplier);
        }
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new ConfigurationException("margin.scale must be positive, got " + scale);
        }
        if (!(straightSetsBonus >= 0)) {
            throw new ConfigurationException("margin.straight-sets-bonus must be >= 0, got " + straightSetsBonus);
        }
        this.maxMultiplier = maxMultiplier;
        this.scale = scale;
        this.straightSetsBonus = straightSetsBonus;
    }

    public boolean isUsable(Score score) {
        return score != null && score.isConsistent();
    }

    /**
     * Winning margin in game units; zero for the narrowest possible win.
     */
    public double marginUnits(Score score) {
        double units = Math.max(0, score.gameMargin());
        if (score.straightSets()) {
            units += straightSetsBonus;
        }
        return units;
    }

    /**
     * Multiplier for the score, or {@link #NEUTRAL} when the score is missing or inconsistent.
     */
    public double multiplier(Score score) {
        if (!isUsable(score)) {
            return NEUTRAL;
        }
        return multiplierForUnits(marginUnits(score));
    }

    double multiplierForUnits(double units) {
        return NEUTRAL + (maxMultiplier - NEUTRAL) * (1 - Math.exp(-units / scale));
    }

    public double getMaxMultiplier() { return maxMultiplier; }
}
