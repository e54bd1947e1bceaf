package com.progression.condition;

import java.util.Locale;

/**
 * Requires a weapon proficiency, focus or specialization feat for a weapon group.
 * The group "selected weapon group" accepts any group.
 */
public record WeaponTraining(Level level, String group) implements Condition {

    static final String ANY_GROUP = "selected weapon group";

    public enum Level {
        PROFICIENCY("Weapon Proficiency"),
        FOCUS("Weapon Focus"),
        SPECIALIZATION("Weapon Specialization");

        private final String featName;

        Level(String featName) {
            this.featName = featName;
        }

        public String featName() {
            return featName;
        }
    }

    /**
     * Canonical feat name this condition is satisfied by, e.g. "Weapon Focus (Pistols)".
     */
    public String featureName() {
        return level.featName() + " (" + group + ")";
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        String prefix = level.featName().toLowerCase(Locale.ROOT);
        String wantedGroup = group.toLowerCase(Locale.ROOT);
        boolean anyGroup = ANY_GROUP.equals(wantedGroup);
        return context.snapshot().getFeatNames().stream()
                .anyMatch(feat -> feat.contains(prefix) && (anyGroup || feat.contains(wantedGroup)));
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        if (level == Level.PROFICIENCY) {
            return "Requires Weapon Proficiency (" + group + ")";
        }
        return "Requires " + level.featName() + " with " + group;
    }

    @Override
    public String describe() {
        return featureName();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.WEAPON_TRAINING;
    }
}
