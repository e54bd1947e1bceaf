package com.progression.condition;

/**
 * Which owned set a feature-name check looks in.
 */
public enum FeatureKind {
    FEAT,
    TALENT,
    ANY
}
