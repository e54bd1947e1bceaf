package com.progression.snapshot;

import java.util.List;

/**
 * A known Force power with its descriptor categories (e.g. "telekinetic", "dark side").
 */
public record ForcePower(String name, List<String> categories) {

    public ForcePower {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public boolean hasCategory(String category) {
        return categories.stream().anyMatch(c -> c.equalsIgnoreCase(category));
    }
}
