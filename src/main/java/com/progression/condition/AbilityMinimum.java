package com.progression.condition;

import com.progression.snapshot.Ability;

/**
 * Requires an ability score of at least {@code minimum}.
 */
public record AbilityMinimum(Ability ability, int minimum) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.snapshot().abilityScore(ability) >= minimum;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + ability.name() + " " + minimum
                + " (you have " + context.snapshot().abilityScore(ability) + ")";
    }

    @Override
    public String describe() {
        return ability.name() + " " + minimum;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ABILITY_MINIMUM;
    }
}
