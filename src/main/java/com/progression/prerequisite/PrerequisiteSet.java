package com.progression.prerequisite;

import com.progression.condition.AllOf;
import com.progression.condition.AnyOf;
import com.progression.condition.Condition;
import com.progression.condition.Not;

import java.util.ArrayList;
import java.util.List;

/**
 * A list of conditions plus the combinator that joins them.
 */
public record PrerequisiteSet(List<Condition> conditions, CombinatorMode mode) {

    private static final PrerequisiteSet NONE = new PrerequisiteSet(List.of(), CombinatorMode.ALL);

    public PrerequisiteSet {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        mode = mode == null ? CombinatorMode.ALL : mode;
    }

    public static PrerequisiteSet none() {
        return NONE;
    }

    public static PrerequisiteSet allOf(Condition... conditions) {
        return new PrerequisiteSet(List.of(conditions), CombinatorMode.ALL);
    }

    public static PrerequisiteSet anyOf(Condition... conditions) {
        return new PrerequisiteSet(List.of(conditions), CombinatorMode.ANY);
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Every leaf condition that must or may hold, descending into AND and OR groups.
     * Negated conditions are skipped.
     */
    public List<Condition> positiveConditions() {
        List<Condition> result = new ArrayList<>();
        collect(conditions, result);
        return result;
    }

    private static void collect(List<Condition> conditions, List<Condition> result) {
        for (Condition condition : conditions) {
            if (condition instanceof AnyOf any) {
                collect(any.conditions(), result);
            } else if (condition instanceof AllOf all) {
                collect(all.conditions(), result);
            } else if (!(condition instanceof Not)) {
                result.add(condition);
            }
        }
    }
}
