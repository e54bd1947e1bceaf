package com.progression.synergy;

import com.progression.condition.EvaluationContext;
import com.progression.snapshot.CharacterSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of SynergyDetector.
 * <p>
 * Each trigger is evaluated independently; an exception from one trigger is logged and the rule
 * treated as inactive.
 */
public class DefaultSynergyDetector implements SynergyDetector {

    private static final Logger log = LoggerFactory.getLogger(DefaultSynergyDetector.class);

    private static final double DEFAULT_EMPHASIS = 1.0;

    private static final Comparator<ActiveSynergy> ORDER =
            Comparator.<ActiveSynergy>comparingInt(s -> s.priority().rank())
                    .thenComparing(Comparator.comparingDouble(ActiveSynergy::weight).reversed());

    private final List<SynergyRule> rules;
    private final Map<String, Double> themeEmphasis;

    /**
     * @param rules         Rule table
     * @param themeEmphasis Per-archetype emphasis weight; archetypes not listed weigh 1.0
     */
    public DefaultSynergyDetector(List<SynergyRule> rules, Map<String, Double> themeEmphasis) {
        this.rules = List.copyOf(rules);
        this.themeEmphasis = themeEmphasis == null ? Map.of() : Map.copyOf(themeEmphasis);
    }

    @Override
    public List<ActiveSynergy> findActiveSynergies(CharacterSnapshot snapshot) {
        EvaluationContext context = EvaluationContext.of(snapshot);
        List<ActiveSynergy> active = new ArrayList<>();

        for (SynergyRule rule : rules) {
            try {
                if (rule.trigger().evaluate(context)) {
                    active.add(new ActiveSynergy(rule, emphasis(rule.archetype())));
                }
            } catch (RuntimeException e) {
                log.warn("Synergy {} failed to evaluate, skipping: {}", rule.id(), e.getMessage());
            }
        }

        active.sort(ORDER);
        log.debug("Active synergies for {}: {}", snapshot.getCharacterId(),
                active.stream().map(ActiveSynergy::id).toList());
        return active;
    }

    @Override
    public Optional<SynergyMatch> getSynergyForItem(String itemName, SuggestionKind kind, CharacterSnapshot snapshot) {
        if (itemName == null || kind == null) {
            return Optional.empty();
        }
        return SynergyMatch.find(itemName, kind, findActiveSynergies(snapshot));
    }

    @Override
    public List<SynergyRule> getRules() {
        return rules;
    }

    // Helper methods

    private double emphasis(String archetype) {
        if (archetype == null) {
            return DEFAULT_EMPHASIS;
        }
        return themeEmphasis.getOrDefault(archetype, DEFAULT_EMPHASIS);
    }
}
