package com.progression.prerequisite;

import java.util.Locale;

/**
 * One way of gaining access to a talent tree.
 *
 * @param type      Rule kind
 * @param tradition Required Force tradition for {@link Type#FORCE_TRADITION}, null otherwise
 */
public record TalentTreeAccessRule(Type type, String tradition) {

    public enum Type {
        /** Granted by class levels; resolved by the class progression, never here. */
        CLASS,
        /** Open to any Force-sensitive character. */
        FORCE_GENERIC,
        /** Force-sensitive members of a named tradition. */
        FORCE_TRADITION;

        public static Type fromName(String name) {
            return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }
}
