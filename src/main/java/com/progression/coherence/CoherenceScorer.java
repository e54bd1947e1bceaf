package com.progression.coherence;

import com.progression.snapshot.CharacterSnapshot;
import com.progression.suggestion.Candidate;

/**
 * Continuous measure of how well a candidate fits an existing build.
 * Implementations never throw; missing data or internal failure yields {@link #NEUTRAL}.
 */
public interface CoherenceScorer {

    double NEUTRAL = 0.5;

    /**
     * @return score in [0, 1]
     */
    double score(Candidate candidate, CharacterSnapshot snapshot);
}
