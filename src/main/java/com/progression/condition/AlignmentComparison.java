package com.progression.condition;

import com.progression.snapshot.Ability;

/**
 * Compares the Dark Side Score against an ability score, e.g. "Dark Side Score >= WIS".
 */
public record AlignmentComparison(ComparisonOperator operator, Ability ability) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return operator.apply(context.snapshot().getDarkSideScore(), context.snapshot().abilityScore(ability));
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires Dark Side Score " + operator.symbol() + " " + ability.name()
                + " (DSP: " + context.snapshot().getDarkSideScore()
                + ", " + ability.name() + ": " + context.snapshot().abilityScore(ability) + ")";
    }

    @Override
    public String describe() {
        return "Dark Side Score " + operator.symbol() + " " + ability.name();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALIGNMENT_COMPARISON;
    }
}
