package com.progression.suggestion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Name keywords per mentor-survey bias dimension. Dimension order is the resolution order.
 */
public final class MentorBiasKeywords {

    private final Map<String, List<String>> keywordsByDimension;

    public MentorBiasKeywords(Map<String, List<String>> keywordsByDimension) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        keywordsByDimension.forEach((dimension, keywords) -> copy.put(
                dimension.toLowerCase(Locale.ROOT),
                keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList()));
        this.keywordsByDimension = Collections.unmodifiableMap(copy);
    }

    public static MentorBiasKeywords empty() {
        return new MentorBiasKeywords(Map.of());
    }

    /**
     * Resolve the bias dimension a candidate speaks to: its declared build bias first,
     * then its tags, then keywords in its name. Only dimensions accepted by {@code active} count.
     */
    public Optional<String> resolve(Candidate candidate, Predicate<String> active) {
        String declared = candidate.getBuildBias();
        if (declared != null) {
            String lower = declared.toLowerCase(Locale.ROOT);
            if (keywordsByDimension.containsKey(lower) && active.test(lower)) {
                return Optional.of(lower);
            }
        }

        for (String tag : candidate.getTags()) {
            String lowerTag = tag.toLowerCase(Locale.ROOT);
            for (String dimension : keywordsByDimension.keySet()) {
                if (dimension.equals(lowerTag) && active.test(dimension)) {
                    return Optional.of(dimension);
                }
            }
        }

        String name = candidate.getName().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : keywordsByDimension.entrySet()) {
            if (active.test(entry.getKey()) && entry.getValue().stream().anyMatch(name::contains)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public Map<String, List<String>> getKeywordsByDimension() {
        return keywordsByDimension;
    }
}
