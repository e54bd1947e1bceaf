package com.progression.condition;

/**
 * Requires a base attack bonus of at least {@code minimum}.
 */
public record AttackBonusMinimum(int minimum) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return context.snapshot().getBaseAttackBonus() >= minimum;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires BAB +" + minimum + " (you have +" + context.snapshot().getBaseAttackBonus() + ")";
    }

    @Override
    public String describe() {
        return "BAB +" + minimum;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ATTACK_BONUS_MINIMUM;
    }
}
