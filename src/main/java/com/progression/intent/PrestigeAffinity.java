package com.progression.intent;

import java.util.List;

/**
 * How strongly a character's build points toward one prestige class.
 *
 * @param className  Prestige class
 * @param confidence Normalized score in [0, 1]
 * @param score      Raw weighted score
 * @param matches    Signals that matched
 */
public record PrestigeAffinity(String className, double confidence, int score, Matches matches) {

    /**
     * Matched evidence, grouped by signal category.
     */
    public record Matches(List<String> feats,
                          List<String> skills,
                          List<String> talents,
                          List<String> talentTrees,
                          List<String> abilities) {

        public Matches {
            feats = List.copyOf(feats);
            skills = List.copyOf(skills);
            talents = List.copyOf(talents);
            talentTrees = List.copyOf(talentTrees);
            abilities = List.copyOf(abilities);
        }
    }
}
