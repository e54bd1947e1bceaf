package com.progression.coherence;

/**
 * Single attribute dominance check.
 *
 * @param dominantAttribute Key of the highest ability, null when unknown
 * @param concentration     Top score relative to the mean of the others, normalized to [0, 1]
 */
public record SadReport(String dominantAttribute, double concentration) {
}
