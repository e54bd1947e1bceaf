package com.progression.coherence;

import com.progression.snapshot.CharacterSnapshot;
import com.progression.suggestion.Candidate;
import com.progression.synergy.SuggestionKind;
import com.progression.synergy.SynergyDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coherence variant that also rewards membership in an active synergy rule.
 * <p>
 * Weights: ability match 0.30, tree clustering 0.20, combat style 0.20, class fit 0.15,
 * active synergy 0.15.
 */
public class SynergyEvaluator implements CoherenceScorer {

    private static final Logger log = LoggerFactory.getLogger(SynergyEvaluator.class);

    static final double ABILITY_WEIGHT = 0.30;
    static final double TREE_WEIGHT = 0.20;
    static final double COMBAT_WEIGHT = 0.20;
    static final double CLASS_WEIGHT = 0.15;
    static final double SYNERGY_WEIGHT = 0.15;

    private static final double SYNERGY_MEMBER = 1.0;

    private final BuildCoherenceAnalyzer signals;
    private final SynergyDetector synergyDetector;

    public SynergyEvaluator(BuildCoherenceAnalyzer signals, SynergyDetector synergyDetector) {
        this.signals = signals;
        this.synergyDetector = synergyDetector;
    }

    @Override
    public double score(Candidate candidate, CharacterSnapshot snapshot) {
        if (candidate == null || snapshot == null || !(candidate.isFeat() || candidate.isTalent())) {
            return NEUTRAL;
        }
        try {
            double score = signals.attributeCoherence(candidate, snapshot) * ABILITY_WEIGHT
                    + signals.talentClustering(candidate, snapshot) * TREE_WEIGHT
                    + signals.combatStyle(candidate, snapshot) * COMBAT_WEIGHT
                    + signals.classProgression(candidate, snapshot) * CLASS_WEIGHT
                    + synergyMembership(candidate, snapshot) * SYNERGY_WEIGHT;
            return Math.min(1.0, Math.max(0.0, score));
        } catch (RuntimeException e) {
            log.warn("Synergy evaluation failed for {}: {}", candidate, e.getMessage());
            return NEUTRAL;
        }
    }

    private double synergyMembership(Candidate candidate, CharacterSnapshot snapshot) {
        SuggestionKind kind = candidate.isFeat() ? SuggestionKind.FEAT : SuggestionKind.TALENT;
        return synergyDetector.getSynergyForItem(candidate.getName(), kind, snapshot).isPresent()
                ? SYNERGY_MEMBER
                : NEUTRAL;
    }
}
