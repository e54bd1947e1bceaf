package com.progression.suggestion;

import java.util.List;

/**
 * A feat or talent with its ranking outcome.
 *
 * @param candidate     The candidate
 * @param suggestion    Ranking outcome; null when the candidate is not legal and future mode is off
 * @param qualified     Whether the prerequisites are currently met
 * @param unmetReasons  Reasons for unmet prerequisites, empty when qualified
 * @param coherence     Continuous build-coherence confidence in [0, 1]
 */
public record RankedCandidate(Candidate candidate,
                              Suggestion suggestion,
                              boolean qualified,
                              List<String> unmetReasons,
                              double coherence) {

    public RankedCandidate {
        unmetReasons = List.copyOf(unmetReasons);
    }

    public double tier() {
        return suggestion == null ? -1 : suggestion.tier();
    }
}
