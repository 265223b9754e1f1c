package com.tennis.rating.config;

import com.tennis.rating.model.Tier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables of the rating model. Defaults are starting points to be tuned against the
 * evaluation metrics, not fitted values.
 */
@ConfigurationProperties(prefix = "tennis.rating")
public class RatingProperties {

    private double defaultRating = 1500.0;
    private double scale = 400.0;
    private Map<Tier, Double> tierWeights = defaultTierWeights();
    private int calibrationBuckets = 10;

    private final Margin margin = new Margin();
    private final Form form = new Form();
    private final Blend blend = new Blend();

    private static Map<Tier, Double> defaultTierWeights() {
        Map<Tier, Double> weights = new EnumMap<>(Tier.class);
        weights.put(Tier.ITF, 24.0);
        weights.put(Tier.TOUR, 32.0);
        return weights;
    }

    public double getDefaultRating() { return defaultRating; }
    public void setDefaultRating(double defaultRating) { this.defaultRating = defaultRating; }

    public double getScale() { return scale; }
    public void setScale(double scale) { this.scale = scale; }

    public Map<Tier, Double> getTierWeights() { return tierWeights; }
    public void setTierWeights(Map<Tier, Double> tierWeights) { this.tierWeights = tierWeights; }

    public int getCalibrationBuckets() { return calibrationBuckets; }
    public void setCalibrationBuckets(int calibrationBuckets) { this.calibrationBuckets = calibrationBuckets; }

    public Margin getMargin() { return margin; }

    public Form getForm() { return form; }

    public Blend getBlend() { return blend; }

    public static class Margin {
        private double maxMultiplier = 1.5;
        private double scale = 8.0;             // game units for ~63% of the max boost
        private double straightSetsBonus = 2.0; // extra game units when no set is dropped

        public double getMaxMultiplier() { return maxMultiplier; }
        public void setMaxMultiplier(double maxMultiplier) { this.maxMultiplier = maxMultiplier; }

        public double getScale() { return scale; }
        public void setScale(double scale) { this.scale = scale; }

        public double getStraightSetsBonus() { return straightSetsBonus; }
        public void setStraightSetsBonus(double straightSetsBonus) { this.straightSetsBonus = straightSetsBonus; }
    }

    public static class Form {
        private double halfLifeDays = 30.0;
        private double updateRate = 0.2;
        private double scale = 400.0;           // rating points per unit of form

        public double getHalfLifeDays() { return halfLifeDays; }
        public void setHalfLifeDays(double halfLifeDays) { this.halfLifeDays = halfLifeDays; }

        public double getUpdateRate() { return updateRate; }
        public void setUpdateRate(double updateRate) { this.updateRate = updateRate; }

        public double getScale() { return scale; }
        public void setScale(double scale) { this.scale = scale; }
    }

    public static class Blend {
        private double currentWeight = 0.6;     // beta
        private double formWeight = 0.1;        // gamma
        private double baselineShare = 0.1;     // epsilon

        public double getCurrentWeight() { return currentWeight; }
        public void setCurrentWeight(double currentWeight) { this.currentWeight = currentWeight; }

        public double getFormWeight() { return formWeight; }
        public void setFormWeight(double formWeight) { this.formWeight = formWeight; }

        public double getBaselineShare() { return baselineShare; }
        public void setBaselineShare(double baselineShare) { this.baselineShare = baselineShare; }
    }
}
