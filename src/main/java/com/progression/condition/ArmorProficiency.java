package com.progression.condition;

import java.util.Locale;

/**
 * Requires an Armor Proficiency feat for the given armor type.
 */
public record ArmorProficiency(String armorType) implements Condition {

    public String featureName() {
        return "Armor Proficiency (" + armorType + ")";
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        String wanted = armorType.toLowerCase(Locale.ROOT);
        return context.snapshot().getFeatNames().stream()
                .anyMatch(feat -> feat.contains("armor proficiency") && feat.contains(wanted));
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + featureName();
    }

    @Override
    public String describe() {
        return featureName();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ARMOR_PROFICIENCY;
    }
}
