package com.progression.coherence;

import com.progression.snapshot.Ability;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword tables used by the coherence scorers.
 *
 * @param treeAlignments Lowercased talent tree to feat-name keywords that reinforce it
 * @param classThemes    Class name to item-name keywords that fit it
 * @param madKeywords    Ability to feature-name keywords that depend on it
 */
public record CoherenceTables(Map<String, List<String>> treeAlignments,
                              Map<String, List<String>> classThemes,
                              Map<Ability, List<String>> madKeywords) {

    public CoherenceTables {
        treeAlignments = lowerKeys(treeAlignments);
        classThemes = classThemes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classThemes));
        madKeywords = madKeywords == null || madKeywords.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(madKeywords));
    }

    public static CoherenceTables empty() {
        return new CoherenceTables(Map.of(), Map.of(), Map.of());
    }

    public List<String> alignmentKeywords(String lowerTree) {
        return treeAlignments.getOrDefault(lowerTree, List.of());
    }

    public List<String> classKeywords(String className) {
        List<String> exact = classThemes.get(className);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, List<String>> entry : classThemes.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(className)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    private static Map<String, List<String>> lowerKeys(Map<String, List<String>> map) {
        if (map == null) {
            return Map.of();
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(key.toLowerCase(Locale.ROOT), List.copyOf(value)));
        return Collections.unmodifiableMap(result);
    }
}
