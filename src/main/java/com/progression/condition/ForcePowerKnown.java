package com.progression.condition;

import com.progression.snapshot.ForcePower;

import java.util.List;

/**
 * Requires specific Force powers (all of {@code names}), or {@code count} powers of a category.
 * With neither names nor category the condition always holds.
 */
public record ForcePowerKnown(List<String> names, String category, int count) implements Condition {

    public ForcePowerKnown {
        names = names == null ? List.of() : List.copyOf(names);
    }

    public static ForcePowerKnown named(String... names) {
        return new ForcePowerKnown(List.of(names), null, 0);
    }

    public static ForcePowerKnown fromCategory(String category, int count) {
        return new ForcePowerKnown(List.of(), category, count);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        List<ForcePower> powers = context.snapshot().getForcePowers();
        if (!names.isEmpty()) {
            return names.stream().allMatch(name -> powers.stream().anyMatch(p -> p.name().equalsIgnoreCase(name)));
        }
        if (category != null) {
            return powers.stream().filter(p -> p.hasCategory(category)).count() >= Math.max(1, count);
        }
        return true;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + describe();
    }

    @Override
    public String describe() {
        if (!names.isEmpty()) {
            return "Force power: " + String.join(", ", names);
        }
        return Math.max(1, count) + " Force power(s) from " + category + " category";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.FORCE_POWER;
    }
}
