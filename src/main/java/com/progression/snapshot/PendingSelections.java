package com.progression.snapshot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Choices made during an in-progress progression session that are not yet committed
 * to the character. Merged into the snapshot's owned sets before evaluation.
 *
 * @param feats         Feats picked this session
 * @param talents       Talents picked this session
 * @param skills        Skills newly trained this session
 * @param selectedClass Class being levelled, or null
 * @param mentorBiases  Mentor-survey answers collected this session
 */
public record PendingSelections(List<OwnedFeature> feats,
                                List<OwnedFeature> talents,
                                List<String> skills,
                                String selectedClass,
                                Map<String, Double> mentorBiases) {

    private static final PendingSelections EMPTY =
            new PendingSelections(List.of(), List.of(), List.of(), null, Map.of());

    public PendingSelections {
        feats = feats == null ? List.of() : List.copyOf(feats);
        talents = talents == null ? List.of() : List.copyOf(talents);
        skills = skills == null ? List.of() : List.copyOf(skills);
        mentorBiases = mentorBiases == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(mentorBiases));
    }

    public static PendingSelections empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return feats.isEmpty() && talents.isEmpty() && skills.isEmpty()
                && selectedClass == null && mentorBiases.isEmpty();
    }
}
