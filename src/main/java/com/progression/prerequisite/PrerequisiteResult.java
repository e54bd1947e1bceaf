package com.progression.prerequisite;

import com.progression.condition.Condition;

import java.util.List;

/**
 * Outcome of evaluating a prerequisite set. Unmet conditions are kept alongside the
 * reason strings so callers can reason about the gaps structurally.
 */
public final class PrerequisiteResult {

    private static final PrerequisiteResult SATISFIED = new PrerequisiteResult(true, List.of(), List.of());

    private final boolean satisfied;
    private final List<String> unmetReasons;
    private final List<Condition> unmetConditions;

    private PrerequisiteResult(boolean satisfied, List<String> unmetReasons, List<Condition> unmetConditions) {
        this.satisfied = satisfied;
        this.unmetReasons = List.copyOf(unmetReasons);
        this.unmetConditions = List.copyOf(unmetConditions);
    }

    public boolean isSatisfied() {
        return satisfied;
    }

    public List<String> getUnmetReasons() {
        return unmetReasons;
    }

    /**
     * Conditions that did not hold. For a failed OR set this is the whole group.
     */
    public List<Condition> getUnmetConditions() {
        return unmetConditions;
    }

    @Override
    public String toString() {
        return "PrerequisiteResult{" +
                "satisfied=" + satisfied +
                ", unmetReasons=" + unmetReasons +
                '}';
    }

    public static PrerequisiteResult satisfied() {
        return SATISFIED;
    }

    public static PrerequisiteResult unsatisfied(List<String> unmetReasons, List<Condition> unmetConditions) {
        return new PrerequisiteResult(false, unmetReasons, unmetConditions);
    }
}
