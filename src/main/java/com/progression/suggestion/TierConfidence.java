package com.progression.suggestion;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Fixed confidence lookup keyed by the nearest whole tier. Half tiers resolve to the lower key.
 */
public final class TierConfidence {

    /**
     * Confidence reported for suggestions that are not legal yet.
     */
    public static final double FUTURE_CONFIDENCE = 0.5;

    private static final NavigableMap<Double, Double> CONFIDENCE = new TreeMap<>(Map.of(
            6.0, 0.95,
            5.0, 0.85,
            4.0, 0.75,
            3.0, 0.60,
            2.0, 0.50,
            1.0, 0.40,
            0.0, 0.20));

    private TierConfidence() {
    }

    public static double forTier(double tier) {
        Map.Entry<Double, Double> floor = CONFIDENCE.floorEntry(tier);
        Map.Entry<Double, Double> ceiling = CONFIDENCE.ceilingEntry(tier);
        if (floor == null) {
            return ceiling.getValue();
        }
        if (ceiling == null) {
            return floor.getValue();
        }
        double below = tier - floor.getKey();
        double above = ceiling.getKey() - tier;
        return above < below ? ceiling.getValue() : floor.getValue();
    }
}
