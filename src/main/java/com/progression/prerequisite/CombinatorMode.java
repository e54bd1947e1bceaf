package com.progression.prerequisite;

import java.util.Locale;

/**
 * How the conditions of a prerequisite set are combined.
 */
public enum CombinatorMode {
    /** Every condition must hold. */
    ALL,
    /** At least one condition must hold. */
    ANY;

    public static CombinatorMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return ALL;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
