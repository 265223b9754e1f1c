package com.tennis.rating.engine;

import com.tennis.rating.exception.ConfigurationException;
import com.tennis.rating.model.Tier;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TierWeightsTest {

    @Test
    void lookup_returnsConfiguredWeight() {
        TierWeights weights = new TierWeights(Fixtures.defaultWeights());
        assertEquals(24.0, weights.weightFor(Tier.ITF));
        assertEquals(32.0, weights.weightFor(Tier.TOUR));
    }

    @Test
    void lowerTier_mustWeighLess() {
        assertThrows(ConfigurationException.class,
                () -> new TierWeights(Map.of(Tier.ITF, 32.0, Tier.TOUR, 32.0)));
        assertThrows(ConfigurationException.class,
                () -> new TierWeights(Map.of(Tier.ITF, 40.0, Tier.TOUR, 32.0)));
    }

    @Test
    void nonPositiveOrMissingTable_isRejected() {
        assertThrows(ConfigurationException.class, () -> new TierWeights(Map.of()));
        assertThrows(ConfigurationException.class, () -> new TierWeights(Map.of(Tier.TOUR, 0.0)));
    }

    @Test
    void unconfiguredTier_failsLookupAndRequireAll() {
        TierWeights tourOnly = new TierWeights(Map.of(Tier.TOUR, 32.0));
        assertFalse(tourOnly.contains(Tier.ITF));
        assertThrows(ConfigurationException.class, () -> tourOnly.weightFor(Tier.ITF));
        assertThrows(ConfigurationException.class, () -> tourOnly.requireAll(EnumSet.allOf(Tier.class)));
        assertDoesNotThrow(() -> tourOnly.requireAll(EnumSet.of(Tier.TOUR)));
    }
}
