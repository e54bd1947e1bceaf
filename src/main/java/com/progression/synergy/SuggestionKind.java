package com.progression.synergy;

import com.progression.exception.ConfigurationException;

import java.util.Locale;

/**
 * Kind of feature a synergy rule suggests.
 */
public enum SuggestionKind {
    FEAT,
    TALENT;

    public static SuggestionKind fromName(String name) {
        if (name == null) {
            throw new ConfigurationException("Synergy suggestion requires a type");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown synergy suggestion type: " + name, e);
        }
    }
}
