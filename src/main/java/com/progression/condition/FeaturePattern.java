package com.progression.condition;

import java.util.Locale;

/**
 * Requires any feat whose name contains {@code pattern}, case-insensitively.
 */
public record FeaturePattern(String pattern, String description) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        String wanted = pattern.toLowerCase(Locale.ROOT);
        return context.snapshot().getFeatNames().stream().anyMatch(feat -> feat.contains(wanted));
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + describe();
    }

    @Override
    public String describe() {
        return description != null ? description : "a feat matching: " + pattern;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.FEATURE_PATTERN;
    }
}
