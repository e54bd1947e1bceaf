package com.progression.condition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical OR group - at least one nested condition must hold. Empty OR is false.
 */
public record AnyOf(List<Condition> conditions) implements Condition {

    public AnyOf {
        conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return conditions.stream().anyMatch(context::holds);
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires one of: " + joined();
    }

    @Override
    public String describe() {
        return "(" + joined() + ")";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ANY_OF;
    }

    private String joined() {
        return conditions.stream().map(Condition::describe).collect(Collectors.joining(" or "));
    }
}
