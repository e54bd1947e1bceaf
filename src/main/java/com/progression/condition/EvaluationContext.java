package com.progression.condition;

import com.progression.snapshot.CharacterSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Input to condition evaluation.
 *
 * @param snapshot    Character being evaluated
 * @param candidateId Id or name of the feature being checked, excluded from self-referencing counts; may be null
 */
public record EvaluationContext(CharacterSnapshot snapshot, String candidateId) {

    private static final Logger log = LoggerFactory.getLogger(EvaluationContext.class);

    public static EvaluationContext of(CharacterSnapshot snapshot) {
        return new EvaluationContext(snapshot, null);
    }

    /**
     * Evaluate a nested condition. One that throws is logged and counts as unmet.
     */
    public boolean holds(Condition condition) {
        try {
            return condition.evaluate(this);
        } catch (RuntimeException e) {
            log.warn("Nested condition {} failed to evaluate for {}, treating as unmet: {}",
                    condition.getType(), candidateId, e.getMessage());
            return false;
        }
    }
}
