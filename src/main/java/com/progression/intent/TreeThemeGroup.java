package com.progression.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A group of talent trees; owning a talent in any of them applies every boost once.
 */
public record TreeThemeGroup(List<String> trees, Map<String, Double> boosts) {

    public TreeThemeGroup {
        trees = List.copyOf(trees);
        boosts = Collections.unmodifiableMap(new LinkedHashMap<>(boosts));
    }
}
