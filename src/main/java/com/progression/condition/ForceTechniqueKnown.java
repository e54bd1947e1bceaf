package com.progression.condition;

/**
 * Requires a number of Force techniques, or one technique associated with a given power.
 */
public record ForceTechniqueKnown(int count, String associatedPower) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        if (count > 0) {
            return context.snapshot().getForceTechniques().size() >= count;
        }
        if (associatedPower != null) {
            return context.snapshot().getForceTechniques().stream()
                    .anyMatch(t -> associatedPower.equalsIgnoreCase(t.associatedPower()));
        }
        return true;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + describe();
    }

    @Override
    public String describe() {
        if (count > 0 || associatedPower == null) {
            return Math.max(1, count) + " Force Technique(s)";
        }
        return "a Technique associated with " + associatedPower;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.FORCE_TECHNIQUE;
    }
}
