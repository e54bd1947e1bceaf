package com.progression.suggestion;

import com.progression.intent.BuildIntent;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assigns every feat or talent candidate exactly one tier from the feature ladder and orders the batch.
 */
public interface SuggestionRanker {

    /**
     * Legal candidates first, then tier descending, then display name ascending. Future-availability
     * tiers only order candidates that are not yet legal; candidates without a suggestion sort last.
     */
    Comparator<RankedCandidate> BY_TIER_THEN_NAME = Comparator
            .<RankedCandidate, Boolean>comparing(RankedCandidate::qualified, Comparator.reverseOrder())
            .thenComparing(Comparator.comparingDouble(RankedCandidate::tier).reversed())
            .thenComparing(r -> r.candidate().getName(), String.CASE_INSENSITIVE_ORDER)
            .thenComparing(r -> r.candidate().getName());

    /**
     * Rank candidates against a character.
     *
     * @param candidates Feats and talents to rank
     * @param snapshot   Committed character state
     * @param pending    Selections made this session, may be null
     * @param intent     Build intent for the same snapshot and pending selections
     * @param options    Future-availability switch and wishlist
     * @return One entry per candidate, sorted; illegal candidates carry a null suggestion unless
     * future availability is on
     */
    List<RankedCandidate> rank(List<Candidate> candidates,
                               CharacterSnapshot snapshot,
                               PendingSelections pending,
                               BuildIntent intent,
                               RankingOptions options);

    /**
     * Sorted copy of already-ranked candidates.
     */
    static List<RankedCandidate> sortBySuggestion(List<RankedCandidate> ranked) {
        List<RankedCandidate> sorted = new ArrayList<>(ranked);
        sorted.sort(BY_TIER_THEN_NAME);
        return sorted;
    }
}
