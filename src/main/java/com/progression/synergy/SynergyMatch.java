package com.progression.synergy;

import java.util.List;
import java.util.Optional;

/**
 * The active rule that recommends a given item, and the matching suggestion entry.
 */
public record SynergyMatch(ActiveSynergy synergy, SynergySuggestion suggestion) {

    public String ruleId() {
        return synergy.id();
    }

    /**
     * First suggestion for the item among already-ordered active synergies.
     */
    public static Optional<SynergyMatch> find(String itemName, SuggestionKind kind, List<ActiveSynergy> active) {
        for (ActiveSynergy synergy : active) {
            for (SynergySuggestion suggestion : synergy.rule().suggestions()) {
                if (suggestion.matches(itemName, kind)) {
                    return Optional.of(new SynergyMatch(synergy, suggestion));
                }
            }
        }
        return Optional.empty();
    }
}
