package com.progression.condition;

/**
 * Requires a character level of at least {@code minimum}.
 */
public record LevelMinimum(int minimum) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.snapshot().getCharacterLevel() >= minimum;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires Character Level " + minimum
                + " (you are level " + context.snapshot().getCharacterLevel() + ")";
    }

    @Override
    public String describe() {
        return "Character Level " + minimum;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.LEVEL_MINIMUM;
    }
}
