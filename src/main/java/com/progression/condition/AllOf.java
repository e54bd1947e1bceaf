package com.progression.condition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical AND group - every nested condition must hold. Empty AND is true.
 */
public record AllOf(List<Condition> conditions) implements Condition {

    public AllOf {
        conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return conditions.stream().allMatch(context::holds);
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return conditions.stream()
                .filter(c -> !context.holds(c))
                .map(c -> c.unmetReason(context))
                .collect(Collectors.joining("; "));
    }

    @Override
    public String describe() {
        return conditions.stream().map(Condition::describe).collect(Collectors.joining(" and "));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALL_OF;
    }
}
