package com.progression.condition;

/**
 * Requires a Dark Side Score of at least {@code minimum}.
 */
public record AlignmentScoreMinimum(int minimum) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.snapshot().getDarkSideScore() >= minimum;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires Dark Side Score " + minimum
                + " (you have " + context.snapshot().getDarkSideScore() + ")";
    }

    @Override
    public String describe() {
        return "Dark Side Score " + minimum;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALIGNMENT_SCORE_MINIMUM;
    }
}
