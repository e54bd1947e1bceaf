package com.progression.intent;

/**
 * Integer weight of each signal category in a prestige signal table.
 * Matched talent trees score with the talent weight; {@code talentTrees} only sets their share of the maximum score.
 */
public record SignalWeights(int feats, int skills, int talents, int talentTrees, int abilities) {

    public static SignalWeights of(int feats, int skills, int talents, int abilities) {
        return new SignalWeights(feats, skills, talents, talents, abilities);
    }
}
