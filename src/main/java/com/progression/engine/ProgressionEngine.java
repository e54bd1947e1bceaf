package com.progression.engine;

import com.progression.intent.BuildIntent;
import com.progression.prerequisite.PrerequisiteResult;
import com.progression.prerequisite.PrerequisiteSet;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;
import com.progression.suggestion.Candidate;
import com.progression.suggestion.RankedCandidate;
import com.progression.suggestion.RankedClass;
import com.progression.suggestion.RankingOptions;
import com.progression.synergy.ActiveSynergy;

import java.util.List;

/**
 * Main entry point for progression recommendations.
 * Ranks feats, talents and classes for a character during level-up.
 * <p>
 * Every operation is synchronous and advisory: evaluation failures inside a single
 * condition, trigger or score are absorbed, so callers always get a fully populated result.
 */
public interface ProgressionEngine {

    /**
     * Rank feat and talent candidates.
     *
     * @param candidates Feats and talents offered this level
     * @param snapshot   Committed character state
     * @param pending    Selections made this session, may be null
     * @return Candidates with their suggestion, tier descending then name ascending
     */
    default List<RankedCandidate> rankFeatures(List<Candidate> candidates, CharacterSnapshot snapshot,
                                               PendingSelections pending) {
        return rankFeatures(candidates, snapshot, pending, RankingOptions.defaults());
    }

    /**
     * Rank feat and talent candidates with wishlist and future-availability options.
     */
    List<RankedCandidate> rankFeatures(List<Candidate> candidates, CharacterSnapshot snapshot,
                                       PendingSelections pending, RankingOptions options);

    /**
     * Rank base, advanced and prestige classes. Sorted by tier plus category bias.
     */
    List<RankedClass> rankClasses(List<Candidate> candidates, CharacterSnapshot snapshot, PendingSelections pending);

    /**
     * Infer the build direction. Results may be served from the build-intent cache.
     */
    BuildIntent analyzeBuildIntent(CharacterSnapshot snapshot, PendingSelections pending);

    /**
     * Synergy rules whose triggers hold for the character, in priority order.
     */
    List<ActiveSynergy> findActiveSynergies(CharacterSnapshot snapshot);

    /**
     * Evaluate a prerequisite set against the character.
     */
    PrerequisiteResult evaluatePrerequisites(CharacterSnapshot snapshot, PrerequisiteSet prerequisites);

    /**
     * Whether the character may take talents from a tree through a non-class route.
     */
    boolean canAccessTalentTree(CharacterSnapshot snapshot, String treeId);

    /**
     * Drop every cached build intent for a character, e.g. when a new progression session starts.
     *
     * @return number of cache entries removed
     */
    int invalidate(String characterId);
}
