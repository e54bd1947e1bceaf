package com.progression.condition;

import java.util.Locale;

/**
 * Requires a species trait whose name contains {@code trait}.
 */
public record SpeciesTrait(String trait) implements Condition {

    @Override
    public boolean evaluate(EvaluationContext context) {
        String wanted = trait.toLowerCase(Locale.ROOT);
        return context.snapshot().getSpeciesTraits().stream().anyMatch(t -> t.contains(wanted));
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + trait + " Species Trait";
    }

    @Override
    public String describe() {
        return trait + " Species Trait";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.SPECIES_TRAIT;
    }
}
