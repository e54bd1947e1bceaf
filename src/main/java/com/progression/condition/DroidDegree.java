package com.progression.condition;

/**
 * Requires a droid of the given degree, e.g. "1st-Degree".
 */
public record DroidDegree(String degree) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.snapshot().isDroid() && degree.equalsIgnoreCase(context.snapshot().getDroidDegree());
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires droid with " + degree + " classification";
    }

    @Override
    public String describe() {
        return degree + " droid";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.DROID_DEGREE;
    }
}
