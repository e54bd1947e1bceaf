package com.progression.suggestion;

import java.util.List;

/**
 * A class with its ranking outcome.
 *
 * @param candidate   The class
 * @param suggestion  Ranking outcome
 * @param tierWithBias Tier plus the class category bias, the value classes are sorted by
 * @param missing     Descriptions of unmet requirements, including unverifiable ones
 */
public record RankedClass(Candidate candidate, Suggestion suggestion, double tierWithBias, List<String> missing) {

    public RankedClass {
        missing = List.copyOf(missing);
    }
}
