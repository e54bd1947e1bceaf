package com.progression.prerequisite;

import com.progression.snapshot.CharacterSnapshot;

/**
 * Interprets prerequisite sets against a character snapshot. Implementations are pure.
 */
public interface PrerequisiteEvaluator {

    /**
     * Evaluate a structured prerequisite set.
     *
     * @param snapshot    Character being checked
     * @param set         Conditions and combinator
     * @param candidateId Feature being checked, excluded from tree counts; may be null
     * @return Satisfaction flag with the reasons for every unmet condition
     */
    PrerequisiteResult evaluate(CharacterSnapshot snapshot, PrerequisiteSet set, String candidateId);

    default PrerequisiteResult evaluate(CharacterSnapshot snapshot, PrerequisiteSet set) {
        return evaluate(snapshot, set, null);
    }

    /**
     * Normalize a free-text prerequisite and evaluate it through the structured path.
     */
    PrerequisiteResult evaluateLegacy(CharacterSnapshot snapshot, String prerequisiteText, String candidateId);

    /**
     * Check whether a character may take talents from a tree through a non-class route.
     *
     * @param treeId Talent tree name or id
     * @return false for unknown trees and class-granted trees
     */
    boolean canAccessTalentTree(CharacterSnapshot snapshot, String treeId);
}
