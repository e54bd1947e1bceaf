package com.progression.config;

import com.progression.coherence.CoherenceTables;
import com.progression.condition.Condition;
import com.progression.exception.ConfigurationException;
import com.progression.intent.ClassProfile;
import com.progression.intent.KeywordThemeRule;
import com.progression.intent.PrestigeSignals;
import com.progression.intent.SignalWeights;
import com.progression.intent.ThemeSignals;
import com.progression.intent.TreeThemeGroup;
import com.progression.prerequisite.TalentTreeAccessRule;
import com.progression.snapshot.Ability;
import com.progression.suggestion.MentorBiasKeywords;
import com.progression.synergy.SuggestionKind;
import com.progression.synergy.SynergyPriority;
import com.progression.synergy.SynergyRule;
import com.progression.synergy.SynergySuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the read-only content tables from YAML.
 * <p>
 * Sections may sit at the document root or under a {@code progression} key. A missing section
 * loads as an empty table; a malformed entry fails the whole load.
 */
public class ContentLoader {

    private static final Logger log = LoggerFactory.getLogger(ContentLoader.class);

    public static final String DEFAULT_PATH = "classpath:progression/content.yaml";

    /**
     * Load content tables from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the content file
     * @return Loaded tables
     */
    public static ContentTables load(String path) {
        log.info("Loading progression content from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load content from: " + path, e);
        }
    }

    static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse content tables from an open YAML stream.
     */
    public static ContentTables parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);
        if (loaded == null) {
            throw new ConfigurationException("Content file is empty");
        }
        Map<String, Object> root = asMap(loaded, "document");

        Map<String, Object> content = root.containsKey("progression")
                ? asMap(root.get("progression"), "progression")
                : root;

        try {
            EngineTuning tuning = parseTuning(getMap(content, "tuning"));
            ThemeSignals themes = parseThemes(getMap(content, "themes"));
            MentorBiasKeywords mentorKeywords = new MentorBiasKeywords(
                    parseStringListMap(getMap(content, "mentor-bias-keywords")));
            List<PrestigeSignals> prestigeSignals = parsePrestigeSignals(getMap(content, "prestige-signals"));
            Map<String, ClassProfile> classProfiles = parseClassProfiles(getMap(content, "class-profiles"));

            Map<String, Object> synergy = getMap(content, "synergy");
            Map<String, Double> emphasis = parseDoubleMap(getMap(synergy, "theme-emphasis"));
            List<SynergyRule> rules = parseSynergyRules(getList(synergy, "rules"));

            Map<String, List<TalentTreeAccessRule>> treeAccess =
                    parseTreeAccess(getMap(content, "talent-tree-access"));
            CoherenceTables coherence = parseCoherence(getMap(content, "coherence"));

            List<String> knownClasses = getStrings(content, "known-classes");
            if (knownClasses.isEmpty()) {
                knownClasses = List.copyOf(classProfiles.keySet());
            }
            List<String> knownSpecies = getStrings(content, "known-species");

            ContentTables tables = new ContentTables(prestigeSignals, classProfiles, themes, mentorKeywords,
                    rules, emphasis, treeAccess, coherence, knownClasses, knownSpecies, tuning);

            log.info("Loaded progression content: {} prestige signal tables, {} class profiles, "
                            + "{} synergy rules, {} talent tree access entries, {} known species",
                    prestigeSignals.size(), classProfiles.size(), rules.size(), treeAccess.size(),
                    knownSpecies.size());
            return tables;
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new ConfigurationException("Malformed progression content: " + e.getMessage(), e);
        }
    }

    private static EngineTuning parseTuning(Map<String, Object> map) {
        EngineTuning d = EngineTuning.defaults();
        return new EngineTuning(
                getDouble(map, "prestige-talent-confidence", d.prestigeTalentConfidence()),
                getDouble(map, "primary-theme-threshold", d.primaryThemeThreshold()),
                getInt(map, "primary-theme-count", d.primaryThemeCount()),
                getDouble(map, "force-focus-threshold", d.forceFocusThreshold()),
                getDouble(map, "affinity-inclusion", d.affinityInclusion()),
                getDouble(map, "affinity-normalization", d.affinityNormalization()),
                getDouble(map, "prestige-reason-threshold", d.prestigeReasonThreshold()),
                getDouble(map, "species-half-life", d.speciesHalfLife()));
    }

    private static ThemeSignals parseThemes(Map<String, Object> map) {
        ThemeSignals.Builder builder = ThemeSignals.builder();
        if (map.containsKey("feat-increment")) {
            builder.featIncrement(getDouble(map, "feat-increment", 0));
        }
        if (map.containsKey("skill-increment")) {
            builder.skillIncrement(getDouble(map, "skill-increment", 0));
        }
        if (map.containsKey("class-increment")) {
            builder.classIncrement(getDouble(map, "class-increment", 0));
        }
        if (map.containsKey("mentor-multiplier")) {
            builder.mentorMultiplier(getDouble(map, "mentor-multiplier", 0));
        }

        // feat-themes are listed theme -> feats
        parseStringListMap(getMap(map, "feat-themes")).forEach((theme, feats) ->
                feats.forEach(feat -> builder.featTheme(feat, theme)));

        for (Map<String, Object> rule : getMapList(map, "keyword-rules")) {
            builder.keywordRule(new KeywordThemeRule(
                    getStrings(rule, "keywords"),
                    requireString(rule, "theme", "keyword rule"),
                    getDouble(rule, "increment", 0.1)));
        }
        for (Map<String, Object> group : getMapList(map, "tree-groups")) {
            builder.treeGroup(new TreeThemeGroup(
                    getStrings(group, "trees"),
                    parseDoubleMap(getMap(group, "boosts"))));
        }
        parseStringMap(getMap(map, "skill-themes")).forEach(builder::skillTheme);
        getMap(map, "archetype-bias").forEach((archetype, boosts) ->
                builder.archetypeBias(archetype, parseDoubleMap(asMap(boosts, "archetype-bias." + archetype))));
        parseStringMap(getMap(map, "mentor-themes")).forEach(builder::mentorTheme);
        return builder.build();
    }

    private static List<PrestigeSignals> parsePrestigeSignals(Map<String, Object> map) {
        List<PrestigeSignals> signals = new ArrayList<>();
        map.forEach((className, value) -> {
            Map<String, Object> entry = asMap(value, "prestige-signals." + className);
            Map<String, Object> weights = getMap(entry, "weights");
            int talentWeight = getInt(weights, "talents", 1);
            signals.add(new PrestigeSignals(
                    className,
                    getStrings(entry, "feats"),
                    getStrings(entry, "skills"),
                    getStrings(entry, "talents"),
                    getStrings(entry, "talent-trees"),
                    parseAbilities(getStrings(entry, "abilities")),
                    new SignalWeights(
                            getInt(weights, "feats", 1),
                            getInt(weights, "skills", 1),
                            talentWeight,
                            getInt(weights, "talent-trees", talentWeight),
                            getInt(weights, "abilities", 1))));
        });
        return signals;
    }

    private static Map<String, ClassProfile> parseClassProfiles(Map<String, Object> map) {
        Map<String, ClassProfile> profiles = new LinkedHashMap<>();
        map.forEach((className, value) -> {
            Map<String, Object> entry = asMap(value, "class-profiles." + className);
            profiles.put(className, new ClassProfile(
                    className,
                    parseAbilities(getStrings(entry, "abilities")),
                    getStrings(entry, "skills"),
                    getStrings(entry, "feats"),
                    getStrings(entry, "talents"),
                    getStrings(entry, "talent-trees"),
                    getString(entry, "theme", null)));
        });
        return profiles;
    }

    private static List<SynergyRule> parseSynergyRules(List<Object> list) {
        List<SynergyRule> rules = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> entry = asMap(list.get(i), "synergy rule " + i);
            String id = requireString(entry, "id", "synergy rule " + i);
            String trigger = requireString(entry, "trigger", "synergy rule '" + id + "'");

            Condition condition;
            try {
                condition = TriggerExpressionParser.parse(trigger);
            } catch (ConfigurationException e) {
                throw new ConfigurationException("Synergy rule '" + id + "' has an invalid trigger: "
                        + e.getMessage(), e);
            }

            SynergyPriority priority = SynergyPriority.fromName(getString(entry, "priority", null));
            List<SynergySuggestion> suggestions = new ArrayList<>();
            for (Map<String, Object> s : getMapList(entry, "suggestions")) {
                suggestions.add(new SynergySuggestion(
                        requireString(s, "name", "suggestion of '" + id + "'"),
                        SuggestionKind.fromName(getString(s, "type", null)),
                        getString(s, "reason", ""),
                        s.containsKey("priority") ? SynergyPriority.fromName(getString(s, "priority", null)) : priority));
            }
            if (suggestions.isEmpty()) {
                throw new ConfigurationException("Synergy rule '" + id + "' has no suggestions");
            }
            rules.add(new SynergyRule(id, getString(entry, "name", id), getString(entry, "archetype", null),
                    condition, priority, suggestions));
        }
        return rules;
    }

    private static Map<String, List<TalentTreeAccessRule>> parseTreeAccess(Map<String, Object> map) {
        Map<String, List<TalentTreeAccessRule>> access = new LinkedHashMap<>();
        map.forEach((tree, value) -> {
            List<TalentTreeAccessRule> rules = new ArrayList<>();
            for (Object item : asList(value, "talent-tree-access." + tree)) {
                Map<String, Object> rule = asMap(item, "talent-tree-access." + tree);
                TalentTreeAccessRule.Type type =
                        TalentTreeAccessRule.Type.fromName(requireString(rule, "type", "access rule of " + tree));
                String tradition = getString(rule, "tradition", null);
                if (type == TalentTreeAccessRule.Type.FORCE_TRADITION && tradition == null) {
                    throw new ConfigurationException("Tradition access rule for '" + tree + "' names no tradition");
                }
                rules.add(new TalentTreeAccessRule(type, tradition));
            }
            access.put(tree, rules);
        });
        return access;
    }

    private static CoherenceTables parseCoherence(Map<String, Object> map) {
        Map<Ability, List<String>> mad = new EnumMap<>(Ability.class);
        parseStringListMap(getMap(map, "mad-keywords")).forEach((key, keywords) ->
                mad.put(requireAbility(key), keywords));
        return new CoherenceTables(
                parseStringListMap(getMap(map, "tree-alignments")),
                parseStringListMap(getMap(map, "class-themes")),
                mad);
    }

    private static List<Ability> parseAbilities(List<String> names) {
        List<Ability> abilities = new ArrayList<>(names.size());
        for (String name : names) {
            abilities.add(requireAbility(name));
        }
        return abilities;
    }

    private static Ability requireAbility(String name) {
        return Ability.lookup(name)
                .orElseThrow(() -> new ConfigurationException("Unknown ability '" + name + "'"));
    }

    // Helper methods

    private static Map<String, List<String>> parseStringListMap(Map<String, Object> map) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(key, toStrings(value)));
        return result;
    }

    private static Map<String, String> parseStringMap(Map<String, Object> map) {
        Map<String, String> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(key, value == null ? null : value.toString()));
        return result;
    }

    private static Map<String, Double> parseDoubleMap(Map<String, Object> map) {
        Map<String, Double> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(key, toDouble(value)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("Expected a mapping for " + what + " but found: " + value);
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value, String what) {
        if (!(value instanceof List<?>)) {
            throw new ConfigurationException("Expected a list for " + what + " but found: " + value);
        }
        return (List<Object>) value;
    }

    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? Map.of() : asMap(value, key);
    }

    private static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? List.of() : asList(value, key);
    }

    private static List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : getList(map, key)) {
            result.add(asMap(item, key));
        }
        return result;
    }

    private static List<String> getStrings(Map<String, Object> map, String key) {
        return toStrings(map.get(key));
    }

    private static List<String> toStrings(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).toList();
        }
        return List.of(value.toString());
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static String requireString(Map<String, Object> map, String key, String what) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing '" + key + "' in " + what);
        }
        return value;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        return value == null ? defaultValue : toDouble(value);
    }

    private static double toDouble(Object value) {
        if (value instanceof Number) return ((Number) value).doubleValue();
        return Double.parseDouble(value.toString());
    }
}
