package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.Tier;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup table of K factors per tier.
 *
 * Weights must be positive and strictly increase in {@link Tier} declaration order,
 * so a less reliable circuit never moves ratings as much as a more reliable one.
 */
public class TierWeights {

    private final Map<Tier, Double> weights;

    public TierWeights(Map<Tier, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new ConfigurationException("No tier weights configured");
        }
        EnumMap<Tier, Double> table = new EnumMap<>(Tier.class);
        table.putAll(weights);

        Tier previous = null;
        for (Map.Entry<Tier, Double> entry : table.entrySet()) {
            Double weight = entry.getValue();
            if (weight == null || !(weight > 0) || weight.isInfinite()) {
                throw new ConfigurationException("Tier weight for " + entry.getKey() + " must be positive, got " + weight);
            }
            if (previous != null && !(weight > table.get(previous))) {
                throw new ConfigurationException(String.format(
                        "Tier weight for %s (%.2f) must be larger than for %s (%.2f)",
                        entry.getKey(), weight, previous, table.get(previous)));
            }
            previous = entry.getKey();
        }
        this.weights = Collections.unmodifiableMap(table);
    }

    /**
     * @throws ConfigurationException if the tier has no configured weight
     */
    public double weightFor(Tier tier) {
        Double weight = weights.get(tier);
        if (weight == null) {
            throw new ConfigurationException("No rating weight configured for tier " + tier);
        }
        return weight;
    }

    public boolean contains(Tier tier) {
        return weights.containsKey(tier);
    }

    /**
     * Fail fast before a sweep if any tier in use has no weight.
     */
    public void requireAll(Collection<Tier> tiers) {
        for (Tier tier : tiers) {
            weightFor(tier);
        }
    }

    public Map<Tier, Double> asMap() {
        return weights;
    }
}
