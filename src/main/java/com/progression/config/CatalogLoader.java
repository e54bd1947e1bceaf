package com.progression.config;

import com.progression.exception.ConfigurationException;
import com.progression.suggestion.Candidate;
import com.progression.suggestion.CandidateKind;
import com.progression.suggestion.ClassCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads feat, talent and class definitions from a content catalog YAML, e.g.
 * <pre>
 * feats:
 *   - name: Precise Shot
 *     prerequisite: Point-Blank Shot
 * talents:
 *   - name: Crush
 *     tree: Brawler
 * classes:
 *   - name: Gunslinger
 *     category: prestige
 *     prerequisites: [...]
 * </pre>
 * Structured {@code prerequisites} go through {@link ConditionFactory}; a plain
 * {@code prerequisite} string is kept as legacy text.
 */
public class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private final List<Candidate> feats;
    private final List<Candidate> talents;
    private final List<Candidate> classes;

    private CatalogLoader(List<Candidate> feats, List<Candidate> talents, List<Candidate> classes) {
        this.feats = List.copyOf(feats);
        this.talents = List.copyOf(talents);
        this.classes = List.copyOf(classes);
    }

    public static CatalogLoader load(String path) {
        log.info("Loading content catalog from: {}", path);
        try (InputStream inputStream = ContentLoader.getResource(path).getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load catalog from: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static CatalogLoader parse(InputStream inputStream) {
        Object loaded = new Yaml().load(inputStream);
        if (!(loaded instanceof Map<?, ?>)) {
            throw new ConfigurationException("Catalog file is empty or not a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        CatalogLoader catalog = new CatalogLoader(
                parseAll(root.get("feats"), CandidateKind.FEAT),
                parseAll(root.get("talents"), CandidateKind.TALENT),
                parseAll(root.get("classes"), CandidateKind.CLASS));
        log.info("Loaded catalog: {} feats, {} talents, {} classes",
                catalog.feats.size(), catalog.talents.size(), catalog.classes.size());
        return catalog;
    }

    @SuppressWarnings("unchecked")
    private static List<Candidate> parseAll(Object section, CandidateKind kind) {
        if (section == null) {
            return List.of();
        }
        if (!(section instanceof List<?> list)) {
            throw new ConfigurationException("Catalog section for " + kind + " must be a list");
        }
        List<Candidate> candidates = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new ConfigurationException("Catalog entry must be a mapping: " + item);
            }
            candidates.add(toCandidate((Map<String, Object>) map, kind));
        }
        return candidates;
    }

    /**
     * Build a single candidate from its catalog map.
     */
    public static Candidate toCandidate(Map<String, Object> map, CandidateKind kind) {
        String name = getString(map, "name", null);
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Catalog entry without a name: " + map);
        }
        Candidate.Builder builder = Candidate.builder(name, kind)
                .id(getString(map, "id", null))
                .featType(getString(map, "feat-type", null))
                .talentTree(getString(map, "tree", null))
                .legacyPrerequisite(getString(map, "prerequisite", null))
                .prerequisiteFeature(getString(map, "prerequisite-feature", null))
                .bonusFeatFor(getStrings(map, "bonus-feat-for"))
                .tags(getStrings(map, "tags"))
                .buildBias(getString(map, "build-bias", null))
                .otherRequirements(getStrings(map, "other-requirements"));
        if (map.containsKey("prerequisites")) {
            builder.prerequisites(ConditionFactory.createSet(map.get("prerequisites")));
        }
        if (kind == CandidateKind.CLASS) {
            builder.classCategory(ClassCategory.fromName(getString(map, "category", null)));
        }
        return builder.build();
    }

    public List<Candidate> getFeats() {
        return feats;
    }

    public List<Candidate> getTalents() {
        return talents;
    }

    /**
     * Feats followed by talents.
     */
    public List<Candidate> getFeatures() {
        List<Candidate> features = new ArrayList<>(feats);
        features.addAll(talents);
        return features;
    }

    public List<Candidate> getClasses() {
        return classes;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static List<String> getStrings(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).toList();
        }
        return List.of(value.toString());
    }
}
