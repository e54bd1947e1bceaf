package com.progression.intent;

import com.progression.snapshot.Ability;

import java.util.List;

/**
 * Mechanical and thematic profile of a base or prestige class.
 *
 * @param className   Class name
 * @param abilities   Abilities the class leans on
 * @param skills      Class skills worth training
 * @param feats       Feats that fit the class
 * @param talents     Specific talents that fit the class
 * @param talentTrees Talent trees the class draws from
 * @param theme       Build theme the class signals, may be null
 */
public record ClassProfile(String className,
                           List<Ability> abilities,
                           List<String> skills,
                           List<String> feats,
                           List<String> talents,
                           List<String> talentTrees,
                           String theme) {

    public ClassProfile {
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
        skills = skills == null ? List.of() : List.copyOf(skills);
        feats = feats == null ? List.of() : List.copyOf(feats);
        talents = talents == null ? List.of() : List.copyOf(talents);
        talentTrees = talentTrees == null ? List.of() : List.copyOf(talentTrees);
    }
}
