package com.progression.synergy;

import com.progression.condition.Condition;

import java.util.List;

/**
 * A "proven combo": when the trigger holds, the listed follow-ups are recommended.
 *
 * @param id          Stable identifier, e.g. "pin_to_crush"
 * @param name        Display name
 * @param archetype   Archetype tag used for emphasis weighting
 * @param trigger     Condition over the character
 * @param priority    Priority class
 * @param suggestions Recommended follow-ups
 */
public record SynergyRule(String id,
                          String name,
                          String archetype,
                          Condition trigger,
                          SynergyPriority priority,
                          List<SynergySuggestion> suggestions) {

    public SynergyRule {
        suggestions = List.copyOf(suggestions);
    }
}
