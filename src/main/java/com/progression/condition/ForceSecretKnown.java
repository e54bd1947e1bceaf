package com.progression.condition;

import java.util.List;

/**
 * Requires any Force secret, or all of the named ones.
 */
public record ForceSecretKnown(List<String> names, boolean any) implements Condition {

    public ForceSecretKnown {
        names = names == null ? List.of() : List.copyOf(names);
    }

    public static ForceSecretKnown anySecret() {
        return new ForceSecretKnown(List.of(), true);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        List<String> secrets = context.snapshot().getForceSecrets();
        if (any) {
            return !secrets.isEmpty();
        }
        return names.stream().allMatch(name -> secrets.stream().anyMatch(name::equalsIgnoreCase));
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + describe();
    }

    @Override
    public String describe() {
        return any || names.isEmpty() ? "any Force Secret" : "Force Secret: " + String.join(", ", names);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.FORCE_SECRET;
    }
}
