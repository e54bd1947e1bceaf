package com.progression.condition;

/**
 * Logical NOT.
 */
public record Not(Condition condition) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return !condition.evaluate(context);
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Must not have " + condition.describe();
    }

    @Override
    public String describe() {
        return "not " + condition.describe();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }
}
