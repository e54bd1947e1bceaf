package com.progression.snapshot;

/**
 * A known Force technique, optionally tied to the power it improves.
 */
public record ForceTechnique(String name, String associatedPower) {
}
