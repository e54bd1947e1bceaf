package com.progression.snapshot;

import java.util.Locale;
import java.util.Optional;

/**
 * The six ability scores, in sheet order.
 */
public enum Ability {
    STR("strength"),
    DEX("dexterity"),
    CON("constitution"),
    INT("intelligence"),
    WIS("wisdom"),
    CHA("charisma");

    private final String fullName;

    Ability(String fullName) {
        this.fullName = fullName;
    }

    /**
     * Short lowercase key used in content tables (e.g. "dex").
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String fullName() {
        return fullName;
    }

    /**
     * Resolve an ability from its short key or full name, case-insensitively.
     */
    public static Optional<Ability> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Ability ability : values()) {
            if (ability.key().equals(normalized) || ability.fullName.equals(normalized)) {
                return Optional.of(ability);
            }
        }
        return Optional.empty();
    }
}
