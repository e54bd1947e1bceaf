package com.progression.coherence;

import com.progression.condition.AbilityMinimum;
import com.progression.condition.Condition;
import com.progression.exception.EvaluationException;
import com.progression.prerequisite.legacy.LegacyPrerequisiteNormalizer;
import com.progression.snapshot.Ability;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.OwnedFeature;
import com.progression.suggestion.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Measures how consistent a candidate feat or talent is with the character's existing build.
 * <p>
 * Four signals are combined: attribute coherence (0.30), talent clustering (0.25),
 * combat style (0.25) and class progression (0.20). Each signal falls back to 0.5 on error.
 */
public class BuildCoherenceAnalyzer implements CoherenceScorer {

    private static final Logger log = LoggerFactory.getLogger(BuildCoherenceAnalyzer.class);

    static final double ATTRIBUTE_WEIGHT = 0.30;
    static final double TALENT_WEIGHT = 0.25;
    static final double COMBAT_WEIGHT = 0.25;
    static final double CLASS_WEIGHT = 0.20;

    static final List<String> OWNED_RANGED = List.of("shot", "pistol", "rifle", "ranged", "sniper", "gunslinger");
    static final List<String> OWNED_MELEE = List.of("melee", "martial", "strike", "flurry", "lightsaber");
    static final List<String> FORCE = List.of("force", "jedi", "lightsaber");
    static final List<String> ITEM_RANGED = List.of("shot", "pistol", "rifle", "ranged", "sniper");
    static final List<String> ITEM_MELEE = List.of("melee", "martial", "strike", "flurry");
    static final List<String> FOCUS_RANGED = List.of("shot", "pistol", "rifle", "ranged");

    private static final Pattern DEFENSIVE = Pattern.compile("defense|armor|threshold|toughness");
    private static final int MAX_OPEN_TREES = 3;

    private final CoherenceTables tables;
    private final LegacyPrerequisiteNormalizer normalizer;

    public BuildCoherenceAnalyzer(CoherenceTables tables, LegacyPrerequisiteNormalizer normalizer) {
        this.tables = tables;
        this.normalizer = normalizer;
    }

    @Override
    public double score(Candidate candidate, CharacterSnapshot snapshot) {
        return analyze(candidate, snapshot).score();
    }

    /**
     * Score a candidate and keep the individual signals.
     */
    public CoherenceBreakdown analyze(Candidate candidate, CharacterSnapshot snapshot) {
        if (candidate == null || snapshot == null || !(candidate.isFeat() || candidate.isTalent())) {
            return CoherenceBreakdown.neutral();
        }
        try {
            double attribute = guarded("attribute coherence", () -> attributeCoherence(candidate, snapshot));
            double talent = guarded("talent clustering", () -> talentClustering(candidate, snapshot));
            double combat = guarded("combat style", () -> combatStyle(candidate, snapshot));
            double progression = guarded("class progression", () -> classProgression(candidate, snapshot));

            double score = attribute * ATTRIBUTE_WEIGHT
                    + talent * TALENT_WEIGHT
                    + combat * COMBAT_WEIGHT
                    + progression * CLASS_WEIGHT;
            return new CoherenceBreakdown(clamp(score), attribute, talent, combat, progression);
        } catch (RuntimeException e) {
            log.warn("Coherence analysis failed for {}: {}", candidate, e.getMessage());
            return CoherenceBreakdown.neutral();
        }
    }

    // ====================================================================================
    // Per-candidate signals
    // ====================================================================================

    double attributeCoherence(Candidate candidate, CharacterSnapshot snapshot) {
        List<Map.Entry<Ability, Integer>> ranked = rankedAbilities(snapshot);
        if (ranked.isEmpty()) {
            return NEUTRAL;
        }
        Set<Ability> top = new LinkedHashSet<>();
        ranked.stream().limit(2).forEach(e -> top.add(e.getKey()));
        int topScore = ranked.get(0).getValue();

        Set<Ability> required = requiredAbilities(candidate);
        if (required.isEmpty()) {
            return NEUTRAL;
        }
        long matches = required.stream().filter(top::contains).count();

        if (topScore >= 14 && matches > 0) {
            return 0.9;
        } else if (topScore >= 12 && matches > 0) {
            return 0.7;
        } else if (matches == required.size()) {
            return 0.8;
        } else if (matches > 0) {
            return 0.65;
        }
        return NEUTRAL;
    }

    double talentClustering(Candidate candidate, CharacterSnapshot snapshot) {
        Set<String> trees = new LinkedHashSet<>();
        for (OwnedFeature talent : snapshot.getTalents()) {
            trees.add(treeOrName(talent).toLowerCase(Locale.ROOT));
        }
        if (trees.isEmpty()) {
            return NEUTRAL;
        }

        String tree = candidate.getTalentTree();
        if (candidate.isTalent() && tree != null) {
            String lowerTree = tree.toLowerCase(Locale.ROOT);
            if (trees.contains(lowerTree)) {
                return 0.85;
            }
            return trees.size() < MAX_OPEN_TREES ? 0.6 : 0.4;
        }

        String name = candidate.getName().toLowerCase(Locale.ROOT);
        for (String owned : trees) {
            if (containsAny(name, tables.alignmentKeywords(owned))) {
                return 0.8;
            }
        }
        return NEUTRAL;
    }

    double combatStyle(Candidate candidate, CharacterSnapshot snapshot) {
        long ranged = countMatching(snapshot.getFeatNames(), OWNED_RANGED);
        long melee = countMatching(snapshot.getFeatNames(), OWNED_MELEE);
        long force = countMatching(snapshot.getFeatNames(), FORCE);

        String primary = ranged >= melee && ranged >= force ? "ranged" : melee >= force ? "melee" : "force";
        long styleCount = Stream.of(ranged, melee, force).filter(c -> c > 0).count();

        String name = candidate.getName().toLowerCase(Locale.ROOT);
        boolean isRanged = containsAny(name, ITEM_RANGED);
        boolean isMelee = containsAny(name, ITEM_MELEE);
        boolean isForce = containsAny(name, FORCE);

        if ((primary.equals("ranged") && isRanged)
                || (primary.equals("melee") && isMelee)
                || (primary.equals("force") && isForce)) {
            return 0.8;
        }
        if (styleCount < 2 && ((isRanged && ranged == 0) || (isMelee && melee == 0))) {
            return 0.7;
        }
        if (DEFENSIVE.matcher(name).find()) {
            return 0.7;
        }
        if (styleCount >= 3 && ((isRanged && ranged == 0) || (isMelee && melee == 0) || (isForce && force == 0))) {
            return 0.4;
        }
        return NEUTRAL;
    }

    double classProgression(Candidate candidate, CharacterSnapshot snapshot) {
        if (snapshot.getClassLevels().isEmpty()) {
            return NEUTRAL;
        }
        String name = candidate.getName().toLowerCase(Locale.ROOT);
        double best = 0;
        for (String className : snapshot.getClassLevels().keySet()) {
            List<String> themes = tables.classKeywords(className);
            long matches = themes.stream().filter(name::contains).count();
            if (matches > 0) {
                best = Math.max(best, Math.min(1.0, (double) matches / Math.max(2, themes.size())));
            }
        }
        if (best >= 0.7) {
            return 0.8;
        } else if (best > 0) {
            return 0.6;
        }
        return NEUTRAL;
    }

    // ====================================================================================
    // Whole-build reports
    // ====================================================================================

    /**
     * Overall build coherence from ability concentration alone.
     */
    public double scoreCoherence(CharacterSnapshot snapshot) {
        try {
            List<Map.Entry<Ability, Integer>> ranked = rankedAbilities(snapshot);
            double mean = ranked.stream().mapToInt(Map.Entry::getValue).average().orElse(10);
            double concentration = ranked.get(0).getValue() / mean;
            if (concentration > 1.3) {
                return 0.8;
            } else if (concentration > 1.1) {
                return 0.65;
            }
            return NEUTRAL;
        } catch (RuntimeException e) {
            log.warn("Build coherence scoring failed: {}", e.getMessage());
            return NEUTRAL;
        }
    }

    /**
     * Which abilities the owned feats and talents lean on.
     */
    public MadReport checkMad(CharacterSnapshot snapshot) {
        try {
            List<String> used = new ArrayList<>();
            Set<String> owned = snapshot.getOwnedPrerequisiteNames();
            for (Map.Entry<Ability, List<String>> entry : tables.madKeywords().entrySet()) {
                if (owned.stream().anyMatch(name -> containsAny(name, entry.getValue()))) {
                    used.add(entry.getKey().key());
                }
            }
            return new MadReport(used.size() >= 3, used);
        } catch (RuntimeException e) {
            log.warn("MAD check failed: {}", e.getMessage());
            return new MadReport(false, List.of());
        }
    }

    public SadReport checkSad(CharacterSnapshot snapshot) {
        try {
            List<Map.Entry<Ability, Integer>> ranked = rankedAbilities(snapshot);
            int top = ranked.get(0).getValue();
            double othersMean = ranked.stream().skip(1).mapToInt(Map.Entry::getValue).average().orElse(10);
            double concentration = top / (othersMean == 0 ? 10 : othersMean);
            return new SadReport(ranked.get(0).getKey().key(), Math.min(1.0, concentration / 1.5));
        } catch (RuntimeException e) {
            log.warn("SAD check failed: {}", e.getMessage());
            return new SadReport(null, NEUTRAL);
        }
    }

    public WeaponFocusReport analyzeWeaponFocus(CharacterSnapshot snapshot) {
        Set<String> feats = snapshot.getFeatNames();
        long ranged = countMatching(feats, FOCUS_RANGED);
        long melee = countMatching(feats, ITEM_MELEE);
        long force = countMatching(feats, FORCE);
        long total = ranged + melee + force;
        if (total == 0) {
            return new WeaponFocusReport(null, NEUTRAL);
        }

        String primary = "ranged";
        long max = ranged;
        if (melee > max) {
            primary = "melee";
            max = melee;
        }
        if (force > max) {
            primary = "force";
            max = force;
        }
        return new WeaponFocusReport(primary, 1.0 - (double) max / total);
    }

    public TalentClusterReport analyzeTalentClustering(CharacterSnapshot snapshot) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (OwnedFeature talent : snapshot.getTalents()) {
            counts.merge(treeOrName(talent), 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> trees = new ArrayList<>(counts.entrySet());
        trees.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        int total = snapshot.getTalents().size();
        double fragmentation = total > 0 ? 1.0 - (double) trees.get(0).getValue() / total : NEUTRAL;
        return new TalentClusterReport(
                trees.stream().limit(2).map(Map.Entry::getKey).toList(),
                Math.min(1.0, fragmentation));
    }

    // Helper methods

    private Set<Ability> requiredAbilities(Candidate candidate) {
        Set<Ability> required = new LinkedHashSet<>();
        for (Condition condition : candidate.effectivePrerequisites(normalizer).positiveConditions()) {
            if (condition instanceof AbilityMinimum minimum) {
                required.add(minimum.ability());
            }
        }
        return required;
    }

    private static List<Map.Entry<Ability, Integer>> rankedAbilities(CharacterSnapshot snapshot) {
        List<Map.Entry<Ability, Integer>> ranked = new ArrayList<>(snapshot.getAbilityScores().entrySet());
        ranked.sort(Map.Entry.<Ability, Integer>comparingByValue(Comparator.reverseOrder()));
        return ranked;
    }

    private static String treeOrName(OwnedFeature talent) {
        return talent.talentTree() != null ? talent.talentTree() : talent.name();
    }

    private static long countMatching(Set<String> lowerNames, List<String> keywords) {
        return lowerNames.stream().filter(name -> containsAny(name, keywords)).count();
    }

    static boolean containsAny(String lowerText, List<String> keywords) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    static double guarded(String signal, SignalComputation computation) {
        try {
            double value = computation.compute();
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new EvaluationException("score " + value + " is outside [0, 1]");
            }
            return value;
        } catch (RuntimeException e) {
            log.warn("Coherence signal '{}' failed, using neutral score: {}", signal, e.getMessage());
            return NEUTRAL;
        }
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }

    @FunctionalInterface
    interface SignalComputation {
        double compute();
    }
}
