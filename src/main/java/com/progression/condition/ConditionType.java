package com.progression.condition;

/**
 * Types of prerequisite conditions.
 */
public enum ConditionType {
    // Owned features
    FEATURE_OWNED,
    TALENTS_FROM_TREE,
    FEATURE_PATTERN,

    // Numeric thresholds
    ABILITY_MINIMUM,
    ATTACK_BONUS_MINIMUM,
    LEVEL_MINIMUM,
    CLASS_LEVEL_MINIMUM,
    ALIGNMENT_SCORE_MINIMUM,
    ALIGNMENT_COMPARISON,

    // Training
    SKILL_TRAINED,
    WEAPON_TRAINING,
    ARMOR_PROFICIENCY,

    // Species and body
    SPECIES_MATCH,
    SPECIES_TRAIT,
    DROID_STATUS,
    DROID_DEGREE,

    // The Force
    FORCE_SENSITIVE,
    FORCE_POWER,
    FORCE_TECHNIQUE,
    FORCE_SECRET,

    // Logical
    ANY_OF,
    ALL_OF,
    NOT
}
