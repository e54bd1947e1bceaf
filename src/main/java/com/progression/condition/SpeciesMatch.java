package com.progression.condition;

import java.util.List;

/**
 * Requires the character to be one of the listed species.
 */
public record SpeciesMatch(List<String> species) implements Condition {

    public SpeciesMatch {
        species = List.copyOf(species);
    }

    public static SpeciesMatch of(String species) {
        return new SpeciesMatch(List.of(species));
    }

    /**
     * True when the given species is one of the listed ones.
     */
    public boolean matches(String characterSpecies) {
        return characterSpecies != null && species.stream().anyMatch(characterSpecies::equalsIgnoreCase);
    }

    @Override
    public boolean evaluate(EvaluationContext context) {
        return matches(context.snapshot().getSpecies());
    }

    @Override
    public String unmetReason(EvaluationContext context) {
        return "Requires " + describe();
    }

    @Override
    public String describe() {
        return String.join(" or ", species);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.SPECIES_MATCH;
    }
}
