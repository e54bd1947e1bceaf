package com.progression.condition;

import com.progression.snapshot.CharacterSnapshot;

/**
 * Requires a named feat or talent.
 */
public record FeatureOwned(String name, FeatureKind kind) implements Condition {

    public static FeatureOwned feat(String name) {
        return new FeatureOwned(name, FeatureKind.FEAT);
    }

    public static FeatureOwned talent(String name) {
        return new FeatureOwned(name, FeatureKind.TALENT);
    }

    public static FeatureOwned any(String name) {
        return new FeatureOwned(name, FeatureKind.ANY);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        CharacterSnapshot snapshot = context.snapshot();
        return switch (kind) {
            case FEAT -> snapshot.hasFeat(name);
            case TALENT -> snapshot.hasTalent(name);
            case ANY -> snapshot.ownsFeature(name);
        };
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + name;
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.FEATURE_OWNED;
    }
}
