package com.progression.synergy;

/**
 * A synergy rule whose trigger holds, with its archetype emphasis weight.
 */
public record ActiveSynergy(SynergyRule rule, double weight) {

    public String id() {
        return rule.id();
    }

    public SynergyPriority priority() {
        return rule.priority();
    }
}
