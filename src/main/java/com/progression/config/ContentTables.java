package com.progression.config;

import com.progression.coherence.CoherenceTables;
import com.progression.intent.ClassProfile;
import com.progression.intent.PrestigeSignals;
import com.progression.intent.ThemeSignals;
import com.progression.prerequisite.TalentTreeAccessRule;
import com.progression.suggestion.MentorBiasKeywords;
import com.progression.synergy.SynergyRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only content tables the engine is built from. Loaded once per process.
 *
 * @param prestigeSignals    Prestige-class affinity signals
 * @param classProfiles      Class synergy profiles keyed by class name
 * @param themeSignals       Feature, skill, class, archetype and mentor theme mappings
 * @param mentorBiasKeywords Name keywords per mentor-survey dimension
 * @param synergyRules       Proven combo rules
 * @param themeEmphasis      Per-archetype weight used to order synergy rules of equal priority
 * @param treeAccessRules    Non-class talent tree access rules keyed by tree name
 * @param coherenceTables    Keyword tables for the coherence scorers
 * @param knownClasses       Class names recognised in free-text prerequisites
 * @param knownSpecies       Species names recognised in free-text prerequisites
 * @param tuning             Numeric thresholds
 */
public record ContentTables(List<PrestigeSignals> prestigeSignals,
                            Map<String, ClassProfile> classProfiles,
                            ThemeSignals themeSignals,
                            MentorBiasKeywords mentorBiasKeywords,
                            List<SynergyRule> synergyRules,
                            Map<String, Double> themeEmphasis,
                            Map<String, List<TalentTreeAccessRule>> treeAccessRules,
                            CoherenceTables coherenceTables,
                            List<String> knownClasses,
                            List<String> knownSpecies,
                            EngineTuning tuning) {

    public ContentTables {
        prestigeSignals = List.copyOf(prestigeSignals);
        classProfiles = Collections.unmodifiableMap(new LinkedHashMap<>(classProfiles));
        synergyRules = List.copyOf(synergyRules);
        themeEmphasis = Collections.unmodifiableMap(new LinkedHashMap<>(themeEmphasis));
        treeAccessRules = Collections.unmodifiableMap(new LinkedHashMap<>(treeAccessRules));
        knownClasses = List.copyOf(knownClasses);
        knownSpecies = List.copyOf(knownSpecies);
    }

    /**
     * Tables with no content at all. Every lookup falls back to its permissive default.
     */
    public static ContentTables empty() {
        return new ContentTables(List.of(), Map.of(), ThemeSignals.empty(), MentorBiasKeywords.empty(),
                List.of(), Map.of(), Map.of(), CoherenceTables.empty(), List.of(), List.of(),
                EngineTuning.defaults());
    }
}
