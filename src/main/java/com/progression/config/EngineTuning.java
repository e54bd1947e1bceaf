package com.progression.config;

/**
 * Numeric thresholds used by intent analysis and ranking.
 *
 * @param prestigeTalentConfidence Minimum top-affinity confidence for a talent to rank as a prestige prerequisite
 * @param primaryThemeThreshold    Minimum score for a theme to be primary
 * @param primaryThemeCount        Number of primary themes kept
 * @param forceFocusThreshold      Force theme score that marks a Force-focused build
 * @param affinityInclusion        Confidence a prestige affinity must exceed to be listed
 * @param affinityNormalization    Fraction of the maximum score that counts as full confidence
 * @param prestigeReasonThreshold  Confidence below which no prestige explanation is given
 * @param speciesHalfLife          Character levels over which the species-feature tier halves
 */
public record EngineTuning(double prestigeTalentConfidence,
                           double primaryThemeThreshold,
                           int primaryThemeCount,
                           double forceFocusThreshold,
                           double affinityInclusion,
                           double affinityNormalization,
                           double prestigeReasonThreshold,
                           double speciesHalfLife) {

    public static EngineTuning defaults() {
        return new EngineTuning(0.4, 0.2, 2, 0.3, 0.1, 0.6, 0.2, 3.0);
    }
}
