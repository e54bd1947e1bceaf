package com.progression.intent;

/**
 * Inferred combat style. FORCE covers lightsaber-and-powers builds.
 */
public enum CombatStyle {
    FORCE,
    RANGED,
    MELEE,
    MIXED
}
