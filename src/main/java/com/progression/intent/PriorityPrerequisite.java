package com.progression.intent;

/**
 * A feat or skill the character is missing for one of its top prestige targets.
 *
 * @param kind       FEAT or SKILL
 * @param name       Feat name or skill key
 * @param forClass   Prestige class it leads to
 * @param confidence Confidence of that prestige affinity
 */
public record PriorityPrerequisite(Kind kind, String name, String forClass, double confidence) {

    public enum Kind {
        FEAT,
        SKILL
    }

    public boolean isFeat(String featName) {
        return kind == Kind.FEAT && name.equalsIgnoreCase(featName);
    }
}
