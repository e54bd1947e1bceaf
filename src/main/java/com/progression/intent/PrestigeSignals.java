package com.progression.intent;

import com.progression.snapshot.Ability;

import java.util.List;

/**
 * Evidence that a character is heading toward a prestige class.
 *
 * @param className   Prestige class name
 * @param feats       Required or typical feats
 * @param skills      Skill keys, e.g. "useTheForce"
 * @param talents     Specific talents
 * @param talentTrees Talent trees
 * @param abilities   Key abilities; only the character's single highest ability counts
 * @param weights     Per-category weights
 */
public record PrestigeSignals(String className,
                              List<String> feats,
                              List<String> skills,
                              List<String> talents,
                              List<String> talentTrees,
                              List<Ability> abilities,
                              SignalWeights weights) {

    public PrestigeSignals {
        feats = feats == null ? List.of() : List.copyOf(feats);
        skills = skills == null ? List.of() : List.copyOf(skills);
        talents = talents == null ? List.of() : List.copyOf(talents);
        talentTrees = talentTrees == null ? List.of() : List.copyOf(talentTrees);
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
    }

    /**
     * Score when every declared signal matches.
     */
    public int maxScore() {
        return feats.size() * weights.feats()
                + skills.size() * weights.skills()
                + talents.size() * weights.talents()
                + talentTrees.size() * weights.talentTrees()
                + abilities.size() * weights.abilities();
    }

    public boolean hasTalentTree(String tree) {
        return tree != null && talentTrees.stream().anyMatch(tree::equalsIgnoreCase);
    }
}
