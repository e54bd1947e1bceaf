package com.progression.intent;

import com.progression.snapshot.SkillNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tables that map owned features, skills, classes, archetypes and mentor answers to build themes.
 */
public final class ThemeSignals {

    private final Map<String, String> featThemes;
    private final List<KeywordThemeRule> keywordRules;
    private final List<TreeThemeGroup> treeGroups;
    private final Map<String, String> skillThemes;
    private final Map<String, Map<String, Double>> archetypeBias;
    private final Map<String, String> mentorThemes;
    private final double featIncrement;
    private final double skillIncrement;
    private final double classIncrement;
    private final double mentorMultiplier;

    private ThemeSignals(Builder builder) {
        this.featThemes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.featThemes));
        this.keywordRules = List.copyOf(builder.keywordRules);
        this.treeGroups = List.copyOf(builder.treeGroups);
        this.skillThemes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.skillThemes));
        this.archetypeBias = Collections.unmodifiableMap(new LinkedHashMap<>(builder.archetypeBias));
        this.mentorThemes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.mentorThemes));
        this.featIncrement = builder.featIncrement;
        this.skillIncrement = builder.skillIncrement;
        this.classIncrement = builder.classIncrement;
        this.mentorMultiplier = builder.mentorMultiplier;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ThemeSignals empty() {
        return builder().build();
    }

    /**
     * Theme signalled by a feat name, looked up case-insensitively.
     */
    public String featTheme(String featName) {
        return featName == null ? null : featThemes.get(featName.toLowerCase(Locale.ROOT));
    }

    public String skillTheme(String skill) {
        return skillThemes.get(SkillNames.normalize(skill));
    }

    public Map<String, Double> archetypeBias(String archetype) {
        return archetype == null ? Map.of() : archetypeBias.getOrDefault(archetype, Map.of());
    }

    public String mentorTheme(String biasKey) {
        return mentorThemes.get(biasKey);
    }

    public List<KeywordThemeRule> getKeywordRules() {
        return keywordRules;
    }

    public List<TreeThemeGroup> getTreeGroups() {
        return treeGroups;
    }

    public double getFeatIncrement() {
        return featIncrement;
    }

    public double getSkillIncrement() {
        return skillIncrement;
    }

    public double getClassIncrement() {
        return classIncrement;
    }

    public double getMentorMultiplier() {
        return mentorMultiplier;
    }

    public static final class Builder {
        private final Map<String, String> featThemes = new LinkedHashMap<>();
        private final List<KeywordThemeRule> keywordRules = new ArrayList<>();
        private final List<TreeThemeGroup> treeGroups = new ArrayList<>();
        private final Map<String, String> skillThemes = new LinkedHashMap<>();
        private final Map<String, Map<String, Double>> archetypeBias = new LinkedHashMap<>();
        private final Map<String, String> mentorThemes = new LinkedHashMap<>();
        private double featIncrement = 0.15;
        private double skillIncrement = 0.1;
        private double classIncrement = 0.25;
        private double mentorMultiplier = 0.05;

        private Builder() {
        }

        public Builder featTheme(String featName, String theme) {
            featThemes.put(featName.toLowerCase(Locale.ROOT), theme);
            return this;
        }

        public Builder keywordRule(KeywordThemeRule rule) {
            keywordRules.add(rule);
            return this;
        }

        public Builder treeGroup(TreeThemeGroup group) {
            treeGroups.add(group);
            return this;
        }

        public Builder skillTheme(String skill, String theme) {
            skillThemes.put(SkillNames.normalize(skill), theme);
            return this;
        }

        public Builder archetypeBias(String archetype, Map<String, Double> boosts) {
            archetypeBias.put(archetype, Collections.unmodifiableMap(new LinkedHashMap<>(boosts)));
            return this;
        }

        public Builder mentorTheme(String biasKey, String theme) {
            mentorThemes.put(biasKey, theme);
            return this;
        }

        public Builder featIncrement(double featIncrement) {
            this.featIncrement = featIncrement;
            return this;
        }

        public Builder skillIncrement(double skillIncrement) {
            this.skillIncrement = skillIncrement;
            return this;
        }

        public Builder classIncrement(double classIncrement) {
            this.classIncrement = classIncrement;
            return this;
        }

        public Builder mentorMultiplier(double mentorMultiplier) {
            this.mentorMultiplier = mentorMultiplier;
            return this;
        }

        public ThemeSignals build() {
            return new ThemeSignals(this);
        }
    }
}
