package com.progression.synergy;

import com.progression.snapshot.CharacterSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Matches the synergy rule table against a character.
 */
public interface SynergyDetector {

    /**
     * Rules whose triggers hold, ordered by priority class then emphasis weight.
     * A rule whose trigger fails to evaluate is skipped.
     */
    List<ActiveSynergy> findActiveSynergies(CharacterSnapshot snapshot);

    /**
     * First active rule, in {@link #findActiveSynergies} order, that suggests the named item.
     */
    Optional<SynergyMatch> getSynergyForItem(String itemName, SuggestionKind kind, CharacterSnapshot snapshot);

    /**
     * All rules known to this detector.
     */
    List<SynergyRule> getRules();
}
