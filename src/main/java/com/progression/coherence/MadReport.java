package com.progression.coherence;

import java.util.List;

/**
 * Multiple attribute dependency check.
 *
 * @param mad        True when three or more abilities are leaned on
 * @param attributes Ability keys referenced by owned features
 */
public record MadReport(boolean mad, List<String> attributes) {

    public MadReport {
        attributes = List.copyOf(attributes);
    }

    public int count() {
        return attributes.size();
    }
}
