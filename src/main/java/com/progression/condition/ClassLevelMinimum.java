package com.progression.condition;

/**
 * Requires at least {@code minimum} levels in a class.
 */
public record ClassLevelMinimum(String className, int minimum) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.snapshot().classLevel(className) >= minimum;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + className + " level " + minimum
                + " (you have " + context.snapshot().classLevel(className) + ")";
    }

    @Override
    public String describe() {
        return className + " level " + minimum;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.CLASS_LEVEL_MINIMUM;
    }
}
