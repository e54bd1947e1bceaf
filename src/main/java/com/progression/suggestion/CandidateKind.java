package com.progression.suggestion;

import com.progression.exception.ConfigurationException;

import java.util.Locale;

/**
 * What a candidate is.
 */
public enum CandidateKind {
    FEAT,
    TALENT,
    CLASS;

    public static CandidateKind fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new ConfigurationException("Unknown candidate kind: " + name, e);
        }
    }
}
