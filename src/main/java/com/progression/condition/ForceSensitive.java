package com.progression.condition;

import java.util.Collection;

/**
 * Requires a Force Sensitivity feat.
 */
public record ForceSensitive() implements Condition {

    /**
     * True when any owned feat name marks the character as Force-sensitive.
     */
    public static boolean isForceSensitive(Collection<String> lowerFeatNames) {
        return lowerFeatNames.stream().anyMatch(name -> name.contains("force sensitiv"));
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return isForceSensitive(context.snapshot().getFeatNames());
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires Force Sensitivity";
    }

    @Override
    public String describe() {
        return "Force Sensitivity";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.FORCE_SENSITIVE;
    }
}
