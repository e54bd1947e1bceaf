package com.progression.coherence;

import java.util.List;

/**
 * @param clusteredTrees     The two trees holding the most talents
 * @param fragmentationScore Share of talents outside the largest tree
 */
public record TalentClusterReport(List<String> clusteredTrees, double fragmentationScore) {

    public TalentClusterReport {
        clusteredTrees = List.copyOf(clusteredTrees);
    }
}
