package com.progression.synergy;

import com.progression.exception.ConfigurationException;

import java.util.Locale;

/**
 * Priority class of a synergy rule, strongest first.
 */
public enum SynergyPriority {
    CRITICAL(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int rank;

    SynergyPriority(int rank) {
        this.rank = rank;
    }

    /**
     * Sort rank, lower sorts first.
     */
    public int rank() {
        return rank;
    }

    public static SynergyPriority fromName(String name) {
        if (name == null) {
            return LOW;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown synergy priority: " + name, e);
        }
    }
}
