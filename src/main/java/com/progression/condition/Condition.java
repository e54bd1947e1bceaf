package com.progression.condition;

/**
 * A single typed eligibility rule evaluated against a character snapshot.
 * <p>
 * The set of condition kinds is closed; {@link #getType()} lets callers switch exhaustively.
 */
public sealed interface Condition permits
        FeatureOwned, TalentsFromTree, AbilityMinimum, SkillTrained, AttackBonusMinimum,
        LevelMinimum, AlignmentScoreMinimum, AlignmentComparison, SpeciesMatch, SpeciesTrait,
        DroidStatus, DroidDegree, WeaponTraining, ArmorProficiency, ClassLevelMinimum,
        ForcePowerKnown, ForceTechniqueKnown, ForceSecretKnown, ForceSensitive, FeaturePattern,
        AnyOf, AllOf, Not {

    /**
     * Evaluate this condition against the given context.
     *
     * @param context Snapshot plus the candidate being checked
     * @return true if the condition holds
     */
    boolean evaluate(EvaluationContext context);

    /**
     * Fixed human-readable reason shown when this condition does not hold.
     */
    String unmetReason(EvaluationContext context);

    /**
     * Short description used when this condition is listed inside an OR group.
     */
    String describe();

    /**
     * Get the condition type.
     */
    ConditionType getType();
}
