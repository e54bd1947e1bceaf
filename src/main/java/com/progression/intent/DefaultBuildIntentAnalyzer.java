package com.progression.intent;

import com.progression.config.EngineTuning;
import com.progression.snapshot.Ability;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.OwnedFeature;
import com.progression.snapshot.PendingSelections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Default implementation of BuildIntentAnalyzer.
 * <p>
 * Signals are applied in a fixed order: feats, talent trees, skills, classes, prestige affinities,
 * archetype bias and mentor answers. Theme scores are additive and uncapped.
 */
public class DefaultBuildIntentAnalyzer implements BuildIntentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DefaultBuildIntentAnalyzer.class);

    public static final String THEME_FORCE = "force";
    public static final String THEME_RANGED = "ranged";
    public static final String THEME_MELEE = "melee";

    private static final int PRESTIGE_TARGETS = 3;
    private static final Set<String> FORCE_TREES =
            Set.of("lightsaber combat", "jedi mind tricks", "alter", "control", "sense");

    private final List<PrestigeSignals> prestigeSignals;
    private final Map<String, ClassProfile> classProfiles;
    private final ThemeSignals themeSignals;
    private final EngineTuning tuning;

    public DefaultBuildIntentAnalyzer(List<PrestigeSignals> prestigeSignals,
                                      Map<String, ClassProfile> classProfiles,
                                      ThemeSignals themeSignals,
                                      EngineTuning tuning) {
        this.prestigeSignals = List.copyOf(prestigeSignals);
        this.classProfiles = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        this.classProfiles.putAll(classProfiles);
        this.themeSignals = themeSignals;
        this.tuning = tuning;
    }

    @Override
    public BuildIntent analyze(CharacterSnapshot snapshot, PendingSelections pending) {
        CharacterSnapshot state = snapshot.withPending(pending);
        Map<String, Double> themes = new LinkedHashMap<>();

        analyzeFeats(state, themes);
        analyzeTalentTrees(state, themes);
        analyzeSkills(state, themes);
        analyzeClasses(state, themes);

        List<PrestigeAffinity> affinities = prestigeAffinities(state);

        if (state.getArchetype() != null) {
            themeSignals.archetypeBias(state.getArchetype()).forEach((theme, boost) -> add(themes, theme, boost));
        }
        applyMentorBiases(state.getMentorBiases(), themes);

        List<String> primaryThemes = primaryThemes(themes);
        CombatStyle combatStyle = combatStyle(themes);
        boolean forceFocus = themes.getOrDefault(THEME_FORCE, 0.0) >= tuning.forceFocusThreshold();
        List<PriorityPrerequisite> priority = priorityPrerequisites(state, affinities);

        BuildIntent intent = new BuildIntent(themes, primaryThemes, affinities, combatStyle, forceFocus,
                priority, state.getMentorBiases(), state.getArchetype());
        log.debug("Build intent for {}: {}", state.getCharacterId(), intent);
        return intent;
    }

    @Override
    public Alignment checkFeatAlignment(String featName, BuildIntent intent) {
        if (featName == null) {
            return Alignment.none();
        }
        var priority = intent.priorityFeat(featName);
        if (priority.isPresent()) {
            return Alignment.because("Supports path toward " + priority.get().forClass());
        }

        String theme = themeSignals.featTheme(featName);
        if (theme != null && intent.getPrimaryThemes().contains(theme)) {
            return Alignment.because("Aligns with your " + theme + "-focused build");
        }

        if (intent.isForceFocus() && featName.contains("Force")) {
            return Alignment.because("Supports your Force-focused build");
        }
        if (intent.getCombatStyle() == CombatStyle.RANGED
                && (featName.contains("Shot") || featName.contains("Pistol") || featName.contains("Rifle"))) {
            return Alignment.because("Supports your ranged combat style");
        }
        if (intent.getCombatStyle() == CombatStyle.MELEE
                && (featName.contains("Melee") || featName.contains("Martial"))) {
            return Alignment.because("Supports your melee combat style");
        }
        return Alignment.none();
    }

    @Override
    public Alignment checkTalentAlignment(String talentName, String treeName, BuildIntent intent) {
        if (treeName == null) {
            return Alignment.none();
        }
        List<PrestigeAffinity> targets = intent.getPrestigeAffinities();
        for (PrestigeAffinity target : targets.subList(0, Math.min(PRESTIGE_TARGETS, targets.size()))) {
            PrestigeSignals signals = signalsFor(target.className());
            if (signals != null && signals.hasTalentTree(treeName)) {
                return Alignment.because("Supports path toward " + target.className());
            }
        }
        if (intent.isForceFocus() && FORCE_TREES.contains(treeName.toLowerCase(Locale.ROOT))) {
            return Alignment.because("Supports your Force-focused build");
        }
        return Alignment.none();
    }

    @Override
    public String prestigeRecommendationReason(String className, BuildIntent intent) {
        PrestigeAffinity affinity = intent.affinityFor(className).orElse(null);
        if (affinity == null || affinity.confidence() < tuning.prestigeReasonThreshold()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        PrestigeAffinity.Matches matches = affinity.matches();
        if (!matches.feats().isEmpty()) {
            parts.add("your " + String.join(", ", matches.feats()) + " feat(s)");
        }
        if (!matches.talentTrees().isEmpty()) {
            parts.add(String.join(", ", matches.talentTrees()) + " talents");
        }
        if (!matches.skills().isEmpty()) {
            parts.add("trained " + String.join(", ", matches.skills()));
        }
        return parts.isEmpty() ? "Aligns with your build direction" : "Builds on " + String.join(" and ", parts);
    }

    public List<PrestigeSignals> getPrestigeSignals() {
        return prestigeSignals;
    }

    // ====================================================================================
    // Theme accumulation
    // ====================================================================================

    private void analyzeFeats(CharacterSnapshot state, Map<String, Double> themes) {
        for (OwnedFeature feat : state.getFeats()) {
            String theme = themeSignals.featTheme(feat.name());
            if (theme != null) {
                add(themes, theme, themeSignals.getFeatIncrement());
            }
            for (KeywordThemeRule rule : themeSignals.getKeywordRules()) {
                if (rule.matches(feat.name())) {
                    add(themes, rule.theme(), rule.increment());
                }
            }
        }
    }

    private void analyzeTalentTrees(CharacterSnapshot state, Map<String, Double> themes) {
        for (TreeThemeGroup group : themeSignals.getTreeGroups()) {
            boolean owned = group.trees().stream().anyMatch(state::hasTalentTree);
            if (owned) {
                group.boosts().forEach((theme, boost) -> add(themes, theme, boost));
            }
        }
    }

    private void analyzeSkills(CharacterSnapshot state, Map<String, Double> themes) {
        for (String skill : state.getTrainedSkills()) {
            String theme = themeSignals.skillTheme(skill);
            if (theme != null) {
                add(themes, theme, themeSignals.getSkillIncrement());
            }
        }
    }

    private void analyzeClasses(CharacterSnapshot state, Map<String, Double> themes) {
        for (String className : state.getClassLevels().keySet()) {
            ClassProfile profile = classProfiles.get(className);
            if (profile != null && profile.theme() != null) {
                add(themes, profile.theme(), themeSignals.getClassIncrement());
            }
        }
    }

    private void applyMentorBiases(Map<String, Double> biases, Map<String, Double> themes) {
        biases.forEach((key, value) -> {
            String theme = themeSignals.mentorTheme(key);
            if (theme != null && value > 0) {
                add(themes, theme, value * themeSignals.getMentorMultiplier());
            }
        });
    }

    // ====================================================================================
    // Prestige affinities
    // ====================================================================================

    private List<PrestigeAffinity> prestigeAffinities(CharacterSnapshot state) {
        List<PrestigeAffinity> result = new ArrayList<>();
        for (PrestigeSignals signals : prestigeSignals) {
            SignalWeights weights = signals.weights();
            int score = 0;
            List<String> feats = new ArrayList<>();
            List<String> skills = new ArrayList<>();
            List<String> talents = new ArrayList<>();
            List<String> trees = new ArrayList<>();
            List<String> abilities = new ArrayList<>();

            for (String feat : signals.feats()) {
                if (state.hasFeat(feat)) {
                    score += weights.feats();
                    feats.add(feat);
                }
            }
            for (String skill : signals.skills()) {
                if (state.hasTrainedSkill(skill)) {
                    score += weights.skills();
                    skills.add(skill);
                }
            }
            for (String talent : signals.talents()) {
                if (state.hasTalent(talent)) {
                    score += weights.talents();
                    talents.add(talent);
                }
            }
            for (String tree : signals.talentTrees()) {
                if (state.hasTalentTree(tree)) {
                    score += weights.talents();
                    trees.add(tree);
                }
            }
            Ability highest = state.getHighestAbility();
            for (Ability ability : signals.abilities()) {
                if (ability == highest) {
                    score += weights.abilities();
                    abilities.add(ability.key());
                }
            }

            int maxScore = signals.maxScore();
            double confidence = maxScore > 0
                    ? Math.min(1.0, score / (maxScore * tuning.affinityNormalization()))
                    : 0.0;
            if (confidence > tuning.affinityInclusion()) {
                result.add(new PrestigeAffinity(signals.className(), confidence, score,
                        new PrestigeAffinity.Matches(feats, skills, talents, trees, abilities)));
            }
        }
        result.sort(Comparator.comparingDouble(PrestigeAffinity::confidence).reversed());
        return result;
    }

    private List<PriorityPrerequisite> priorityPrerequisites(CharacterSnapshot state,
                                                            List<PrestigeAffinity> affinities) {
        List<PriorityPrerequisite> result = new ArrayList<>();
        for (PrestigeAffinity target : affinities.subList(0, Math.min(PRESTIGE_TARGETS, affinities.size()))) {
            PrestigeSignals signals = signalsFor(target.className());
            if (signals == null) {
                continue;
            }
            for (String feat : signals.feats()) {
                if (!state.hasFeat(feat)) {
                    result.add(new PriorityPrerequisite(PriorityPrerequisite.Kind.FEAT, feat,
                            target.className(), target.confidence()));
                }
            }
            for (String skill : signals.skills()) {
                if (!state.hasTrainedSkill(skill)) {
                    result.add(new PriorityPrerequisite(PriorityPrerequisite.Kind.SKILL, skill,
                            target.className(), target.confidence()));
                }
            }
        }
        result.sort(Comparator.comparingDouble(PriorityPrerequisite::confidence).reversed());
        return result;
    }

    private PrestigeSignals signalsFor(String className) {
        for (PrestigeSignals signals : prestigeSignals) {
            if (signals.className().equals(className)) {
                return signals;
            }
        }
        return null;
    }

    // ====================================================================================
    // Derived fields
    // ====================================================================================

    private List<String> primaryThemes(Map<String, Double> themes) {
        return themes.entrySet().stream()
                .filter(e -> e.getValue() >= tuning.primaryThemeThreshold())
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(tuning.primaryThemeCount())
                .map(Map.Entry::getKey)
                .toList();
    }

    private CombatStyle combatStyle(Map<String, Double> themes) {
        double threshold = tuning.primaryThemeThreshold();
        double force = themes.getOrDefault(THEME_FORCE, 0.0);
        double ranged = themes.getOrDefault(THEME_RANGED, 0.0);
        double melee = themes.getOrDefault(THEME_MELEE, 0.0);

        if (force > ranged && force > melee && force >= threshold) {
            return CombatStyle.FORCE;
        } else if (ranged > melee && ranged >= threshold) {
            return CombatStyle.RANGED;
        } else if (melee >= threshold) {
            return CombatStyle.MELEE;
        }
        return CombatStyle.MIXED;
    }

    private static void add(Map<String, Double> themes, String theme, double amount) {
        themes.merge(theme, amount, Double::sum);
    }
}
