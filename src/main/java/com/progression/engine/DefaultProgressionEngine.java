package com.progression.engine;

import com.progression.cache.CachingBuildIntentAnalyzer;
import com.progression.intent.BuildIntent;
import com.progression.intent.BuildIntentAnalyzer;
import com.progression.prerequisite.PrerequisiteEvaluator;
import com.progression.prerequisite.PrerequisiteResult;
import com.progression.prerequisite.PrerequisiteSet;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;
import com.progression.suggestion.Candidate;
import com.progression.suggestion.ClassSuggestionRanker;
import com.progression.suggestion.RankedCandidate;
import com.progression.suggestion.RankedClass;
import com.progression.suggestion.RankingOptions;
import com.progression.suggestion.SuggestionRanker;
import com.progression.synergy.ActiveSynergy;
import com.progression.synergy.SynergyDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default implementation of ProgressionEngine.
 * Stateless apart from the optional build-intent cache held by the analyzer.
 */
public class DefaultProgressionEngine implements ProgressionEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultProgressionEngine.class);

    private final PrerequisiteEvaluator prerequisiteEvaluator;
    private final BuildIntentAnalyzer intentAnalyzer;
    private final SynergyDetector synergyDetector;
    private final SuggestionRanker suggestionRanker;
    private final ClassSuggestionRanker classRanker;
    private final RankingOptions defaultOptions;

    public DefaultProgressionEngine(PrerequisiteEvaluator prerequisiteEvaluator,
                                    BuildIntentAnalyzer intentAnalyzer,
                                    SynergyDetector synergyDetector,
                                    SuggestionRanker suggestionRanker,
                                    ClassSuggestionRanker classRanker,
                                    RankingOptions defaultOptions) {
        this.prerequisiteEvaluator = prerequisiteEvaluator;
        this.intentAnalyzer = intentAnalyzer;
        this.synergyDetector = synergyDetector;
        this.suggestionRanker = suggestionRanker;
        this.classRanker = classRanker;
        this.defaultOptions = defaultOptions == null ? RankingOptions.defaults() : defaultOptions;
    }

    @Override
    public List<RankedCandidate> rankFeatures(List<Candidate> candidates, CharacterSnapshot snapshot,
                                              PendingSelections pending) {
        return rankFeatures(candidates, snapshot, pending, defaultOptions);
    }

    @Override
    public List<RankedCandidate> rankFeatures(List<Candidate> candidates, CharacterSnapshot snapshot,
                                              PendingSelections pending, RankingOptions options) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        BuildIntent intent = intentAnalyzer.analyze(snapshot, pending);
        List<RankedCandidate> ranked = suggestionRanker.rank(candidates, snapshot, pending, intent,
                options == null ? defaultOptions : options);
        log.debug("Ranked {} features for {}", ranked.size(), snapshot.getCharacterId());
        return ranked;
    }

    @Override
    public List<RankedClass> rankClasses(List<Candidate> candidates, CharacterSnapshot snapshot,
                                         PendingSelections pending) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return classRanker.rank(candidates, snapshot, pending);
    }

    @Override
    public BuildIntent analyzeBuildIntent(CharacterSnapshot snapshot, PendingSelections pending) {
        return intentAnalyzer.analyze(snapshot, pending);
    }

    @Override
    public List<ActiveSynergy> findActiveSynergies(CharacterSnapshot snapshot) {
        return synergyDetector.findActiveSynergies(snapshot);
    }

    @Override
    public PrerequisiteResult evaluatePrerequisites(CharacterSnapshot snapshot, PrerequisiteSet prerequisites) {
        return prerequisiteEvaluator.evaluate(snapshot, prerequisites);
    }

    @Override
    public boolean canAccessTalentTree(CharacterSnapshot snapshot, String treeId) {
        return prerequisiteEvaluator.canAccessTalentTree(snapshot, treeId);
    }

    @Override
    public int invalidate(String characterId) {
        if (intentAnalyzer instanceof CachingBuildIntentAnalyzer caching) {
            return caching.invalidate(characterId);
        }
        return 0;
    }

    public RankingOptions getDefaultOptions() {
        return defaultOptions;
    }
}
