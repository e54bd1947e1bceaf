package com.progression.condition;

/**
 * Requires the character to be (or not be) a droid.
 */
public record DroidStatus(boolean droid) implements Condition {

    public static DroidStatus required() {
        return new DroidStatus(true);
    }

    public static DroidStatus excluded() {
        return new DroidStatus(false);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.snapshot().isDroid() == droid;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return droid ? "Requires character to be a droid" : "Requires character to not be a droid";
    }

    @Override
    public String describe() {
        return droid ? "Droid" : "Non-droid";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.DROID_STATUS;
    }
}
