package com.progression.coherence;

/**
 * Combined coherence score and the four sub-scores it was built from.
 */
public record CoherenceBreakdown(double score,
                                 double attributeCoherence,
                                 double talentClustering,
                                 double combatStyle,
                                 double classProgression) {

    private static final CoherenceBreakdown NEUTRAL = new CoherenceBreakdown(
            CoherenceScorer.NEUTRAL, CoherenceScorer.NEUTRAL, CoherenceScorer.NEUTRAL,
            CoherenceScorer.NEUTRAL, CoherenceScorer.NEUTRAL);

    public static CoherenceBreakdown neutral() {
        return NEUTRAL;
    }
}
