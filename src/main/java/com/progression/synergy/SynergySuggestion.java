package com.progression.synergy;

/**
 * A follow-up feature recommended by a synergy rule.
 */
public record SynergySuggestion(String name, SuggestionKind kind, String reason, SynergyPriority priority) {

    public boolean matches(String itemName, SuggestionKind itemKind) {
        return kind == itemKind && name.equalsIgnoreCase(itemName);
    }
}
