package com.progression.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.progression.exception.SnapshotException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating CharacterSnapshot and PendingSelections from JSON character documents.
 * <p>
 * Feats, talents, powers and techniques may be given either as plain name strings or as objects:
 * <pre>
 * {
 *   "id": "vel-1",
 *   "level": 4,
 *   "abilities": {"str": 10, "dex": 16},
 *   "classes": {"Scoundrel": 4},
 *   "feats": ["Point-Blank Shot", {"name": "Quick Draw", "tags": ["ranged"]}],
 *   "talents": [{"name": "Knack", "tree": "Fortune"}],
 *   "skills": ["Deception", "Stealth"]
 * }
 * </pre>
 */
public class CharacterSnapshotFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Create a snapshot from a JSON character document.
     *
     * @param json Character document
     * @return Immutable snapshot
     */
    public static CharacterSnapshot fromJson(String json) {
        return fromMap(parseJson(json));
    }

    /**
     * Create pending selections from a JSON payload. Null or blank input yields empty selections.
     */
    public static PendingSelections pendingFromJson(String json) {
        if (json == null || json.isBlank()) {
            return PendingSelections.empty();
        }
        Map<String, Object> map = parseJson(json);
        return new PendingSelections(
                features(map.get("feats"), false),
                features(map.get("talents"), true),
                strings(map.get("skills")),
                string(map, "class", null),
                biases(map.get("mentorBiases")));
    }

    /**
     * Create a snapshot from an already-parsed document.
     */
    @SuppressWarnings("unchecked")
    public static CharacterSnapshot fromMap(Map<String, Object> document) {
        CharacterSnapshot.Builder builder = CharacterSnapshot.builder()
                .characterId(string(document, "id", null))
                .species(string(document, "species", null))
                .characterLevel(integer(document, "level", 0))
                .baseAttackBonus(integer(document, "bab", 0))
                .darkSideScore(integer(document, "darkSideScore", 0))
                .droid(bool(document, "droid"))
                .droidDegree(string(document, "droidDegree", null))
                .archetype(string(document, "archetype", null));

        Object abilities = document.get("abilities");
        if (abilities instanceof Map<?, ?> abilityMap) {
            for (Map.Entry<?, ?> entry : abilityMap.entrySet()) {
                Ability ability = Ability.lookup(String.valueOf(entry.getKey()))
                        .orElseThrow(() -> new SnapshotException("Unknown ability: " + entry.getKey()));
                builder.ability(ability, toInt(entry.getValue(), "abilities." + entry.getKey()));
            }
        }

        Object classes = document.get("classes");
        if (classes instanceof Map<?, ?> classMap) {
            for (Map.Entry<?, ?> entry : classMap.entrySet()) {
                builder.classLevel(String.valueOf(entry.getKey()),
                        toInt(entry.getValue(), "classes." + entry.getKey()));
            }
        } else if (classes instanceof List<?> classList) {
            for (Object item : classList) {
                Map<String, Object> classEntry = (Map<String, Object>) item;
                builder.classLevel(string(classEntry, "name", "Unknown"), integer(classEntry, "level", 1));
            }
        }

        features(document.get("feats"), false).forEach(builder::feat);
        features(document.get("talents"), true).forEach(builder::talent);
        strings(document.get("talentTrees")).forEach(builder::talentTree);
        strings(document.get("skills")).forEach(builder::trainedSkill);
        strings(document.get("speciesTraits")).forEach(builder::speciesTrait);
        strings(document.get("forceSecrets")).forEach(builder::forceSecret);
        biases(document.get("mentorBiases")).forEach(builder::mentorBias);

        for (Object power : list(document.get("forcePowers"))) {
            if (power instanceof Map<?, ?> powerMap) {
                Map<String, Object> typed = (Map<String, Object>) powerMap;
                builder.forcePower(new ForcePower(string(typed, "name", ""), strings(typed.get("categories"))));
            } else {
                builder.forcePower(new ForcePower(String.valueOf(power), List.of()));
            }
        }
        for (Object technique : list(document.get("forceTechniques"))) {
            if (technique instanceof Map<?, ?> techniqueMap) {
                Map<String, Object> typed = (Map<String, Object>) techniqueMap;
                builder.forceTechnique(new ForceTechnique(string(typed, "name", ""),
                        string(typed, "associatedPower", null)));
            } else {
                builder.forceTechnique(new ForceTechnique(String.valueOf(technique), null));
            }
        }

        return builder.build();
    }

    private static Map<String, Object> parseJson(String json) {
        if (json == null || json.isBlank()) {
            throw new SnapshotException("Character document is empty");
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Invalid character document: " + e.getOriginalMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<OwnedFeature> features(Object value, boolean talents) {
        List<OwnedFeature> result = new ArrayList<>();
        for (Object item : list(value)) {
            if (item instanceof Map<?, ?> map) {
                Map<String, Object> typed = (Map<String, Object>) map;
                String name = string(typed, "name", null);
                if (name == null) {
                    throw new SnapshotException("Feature entry without a name: " + typed);
                }
                String tree = talents ? string(typed, "tree", string(typed, "talentTree", null)) : null;
                result.add(new OwnedFeature(string(typed, "id", null), name, tree,
                        strings(typed.get("tags")), string(typed, "tradition", null)));
            } else if (item != null) {
                result.add(new OwnedFeature(null, item.toString(), null, List.of(), null));
            }
        }
        return result;
    }

    private static Map<String, Double> biases(Object value) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() instanceof Number number) {
                    result.put(String.valueOf(entry.getKey()), number.doubleValue());
                }
            }
        }
        return result;
    }

    private static List<?> list(Object value) {
        return value instanceof List<?> items ? items : List.of();
    }

    private static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        for (Object item : list(value)) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static String string(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int integer(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        return toInt(value, key);
    }

    private static boolean bool(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static int toInt(Object value, String field) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new SnapshotException("Field '" + field + "' is not a number: " + value, e);
        }
    }
}
