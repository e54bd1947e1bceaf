package com.progression.prerequisite.legacy;

import com.progression.prerequisite.PrerequisiteSet;

import java.util.List;

/**
 * Result of normalizing free-text prerequisites.
 *
 * @param prerequisites   Recognized conditions, combined with AND
 * @param droppedSegments Segments no rule recognized; they do not constrain eligibility
 */
public record NormalizedPrerequisite(PrerequisiteSet prerequisites, List<String> droppedSegments) {

    public NormalizedPrerequisite {
        droppedSegments = List.copyOf(droppedSegments);
    }
}
