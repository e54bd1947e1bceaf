package com.progression.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inferred build direction of a character: accumulated theme scores, primary themes,
 * prestige-class affinities, combat style and the prerequisites worth prioritising.
 */
public final class BuildIntent {

    private final Map<String, Double> themes;
    private final List<String> primaryThemes;
    private final List<PrestigeAffinity> prestigeAffinities;
    private final CombatStyle combatStyle;
    private final boolean forceFocus;
    private final List<PriorityPrerequisite> priorityPrerequisites;
    private final Map<String, Double> mentorBiases;
    private final String archetype;

    public BuildIntent(Map<String, Double> themes,
                       List<String> primaryThemes,
                       List<PrestigeAffinity> prestigeAffinities,
                       CombatStyle combatStyle,
                       boolean forceFocus,
                       List<PriorityPrerequisite> priorityPrerequisites,
                       Map<String, Double> mentorBiases,
                       String archetype) {
        this.themes = Collections.unmodifiableMap(new LinkedHashMap<>(themes));
        this.primaryThemes = List.copyOf(primaryThemes);
        this.prestigeAffinities = List.copyOf(prestigeAffinities);
        this.combatStyle = combatStyle;
        this.forceFocus = forceFocus;
        this.priorityPrerequisites = List.copyOf(priorityPrerequisites);
        this.mentorBiases = mentorBiases == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(mentorBiases));
        this.archetype = archetype;
    }

    /**
     * Intent with no signals at all.
     */
    public static BuildIntent empty() {
        return new BuildIntent(Map.of(), List.of(), List.of(), CombatStyle.MIXED, false, List.of(), Map.of(), null);
    }

    public double themeScore(String theme) {
        return themes.getOrDefault(theme, 0.0);
    }

    public Optional<PrestigeAffinity> topAffinity() {
        return prestigeAffinities.isEmpty() ? Optional.empty() : Optional.of(prestigeAffinities.get(0));
    }

    public Optional<PrestigeAffinity> affinityFor(String className) {
        return prestigeAffinities.stream()
                .filter(a -> a.className().equalsIgnoreCase(className))
                .findFirst();
    }

    /**
     * Priority prerequisite entry for a feat, if it is one.
     */
    public Optional<PriorityPrerequisite> priorityFeat(String featName) {
        return priorityPrerequisites.stream().filter(p -> p.isFeat(featName)).findFirst();
    }

    /**
     * Mentor-survey weight for a bias dimension, 0 when absent.
     */
    public double mentorBias(String dimension) {
        return mentorBiases.getOrDefault(dimension, 0.0);
    }

    public Map<String, Double> getThemes() {
        return themes;
    }

    public List<String> getPrimaryThemes() {
        return primaryThemes;
    }

    public List<PrestigeAffinity> getPrestigeAffinities() {
        return prestigeAffinities;
    }

    public CombatStyle getCombatStyle() {
        return combatStyle;
    }

    public boolean isForceFocus() {
        return forceFocus;
    }

    public List<PriorityPrerequisite> getPriorityPrerequisites() {
        return priorityPrerequisites;
    }

    public Map<String, Double> getMentorBiases() {
        return mentorBiases;
    }

    public String getArchetype() {
        return archetype;
    }

    @Override
    public String toString() {
        return "BuildIntent{" +
                "primaryThemes=" + primaryThemes +
                ", combatStyle=" + combatStyle +
                ", forceFocus=" + forceFocus +
                ", affinities=" + prestigeAffinities.size() +
                ", priorityPrerequisites=" + priorityPrerequisites.size() +
                '}';
    }
}
