package com.progression.condition;

/**
 * Requires a number of owned talents from one tree. The candidate itself never counts.
 */
public record TalentsFromTree(String tree, int count) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        return owned(context) >= count;
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        if (count <= 1) {
            return "Requires any other " + tree + " talent";
        }
        return "Requires " + count + " other " + tree + " talents (you have " + owned(context) + ")";
    }

    @Override
    public String describe() {
        return count <= 1 ? tree + " talent" : count + " " + tree + " talents";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.TALENTS_FROM_TREE;
    }

    private int owned(EvaluationContext context) {
        return context.snapshot().talentsInTree(tree, context.candidateId());
    }
}
