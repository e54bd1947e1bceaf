package com.progression.suggestion;

import com.progression.exception.ConfigurationException;

import java.util.Locale;

/**
 * Class category, with the bias added to its tier before class ranking compares.
 */
public enum ClassCategory {
    BASE(0),
    ADVANCED(1),
    PRESTIGE(3);

    private final int bias;

    ClassCategory(int bias) {
        this.bias = bias;
    }

    public int bias() {
        return bias;
    }

    public static ClassCategory fromName(String name) {
        if (name == null) {
            return BASE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown class category: " + name, e);
        }
    }
}
