package com.progression.intent;

import com.progression.config.EngineTuning;
import com.progression.snapshot.Ability;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.OwnedFeature;
import com.progression.snapshot.PendingSelections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultBuildIntentAnalyzer.
 */
class DefaultBuildIntentAnalyzerTest {

    private DefaultBuildIntentAnalyzer analyzer;
    private CharacterSnapshot gunner;

    @BeforeEach
    void setUp() {
        ThemeSignals themes = ThemeSignals.builder()
                .featTheme("Point-Blank Shot", "ranged")
                .featTheme("Precise Shot", "ranged")
                .featTheme("Rapid Shot", "ranged")
                .featTheme("Force Sensitivity", "force")
                .keywordRule(new KeywordThemeRule(List.of("Pistol", "Rifle"), "ranged", 0.1))
                .treeGroup(new TreeThemeGroup(List.of("alter", "control"), Map.of("force", 0.2)))
                .skillTheme("Stealth", "stealth")
                .archetypeBias("Sharpshooter", Map.of("ranged", 0.3))
                .mentorTheme("stealth", "stealth")
                .build();

        List<PrestigeSignals> prestige = List.of(
                new PrestigeSignals("Gunslinger", List.of("Point-Blank Shot", "Precise Shot"),
                        List.of(), List.of(), List.of(), List.of(), new SignalWeights(1, 0, 0, 0, 0)),
                new PrestigeSignals("Jedi Knight", List.of("Force Sensitivity", "Force Training"),
                        List.of("Use the Force"), List.of(), List.of("Lightsaber Combat"), List.of(Ability.WIS),
                        SignalWeights.of(1, 1, 1, 1)));

        Map<String, ClassProfile> profiles = Map.of("Soldier", new ClassProfile("Soldier",
                List.of(Ability.STR), List.of(), List.of(), List.of(), List.of(), "combat"));

        analyzer = new DefaultBuildIntentAnalyzer(prestige, profiles, themes, EngineTuning.defaults());

        gunner = CharacterSnapshot.builder()
                .characterId("gunner")
                .feat("Point-Blank Shot")
                .feat("Weapon Proficiency (Pistols)")
                .ability(Ability.DEX, 16)
                .build();
    }

    // =====================================================================
    // Themes
    // =====================================================================

    @Test
    @DisplayName("Should accumulate feat and keyword themes into a ranged style")
    void shouldDetectRangedStyle() {
        BuildIntent intent = analyzer.analyze(gunner, PendingSelections.empty());

        assertEquals(0.25, intent.themeScore("ranged"), 1e-9);
        assertEquals(List.of("ranged"), intent.getPrimaryThemes());
        assertEquals(CombatStyle.RANGED, intent.getCombatStyle());
        assertFalse(intent.isForceFocus());
    }

    @Test
    @DisplayName("Should report a mixed style when no combat theme reaches the threshold")
    void shouldDetectMixedStyle() {
        BuildIntent intent = analyzer.analyze(CharacterSnapshot.builder().feat("Toughness").build(), null);

        assertEquals(CombatStyle.MIXED, intent.getCombatStyle());
        assertTrue(intent.getPrimaryThemes().isEmpty());
    }

    @Test
    @DisplayName("Should mark a Force focus from feats and talent trees")
    void shouldDetectForceFocus() {
        CharacterSnapshot adept = CharacterSnapshot.builder()
                .feat("Force Sensitivity")
                .talent("Move Object", "Alter")
                .build();

        BuildIntent intent = analyzer.analyze(adept, PendingSelections.empty());

        assertEquals(0.35, intent.themeScore("force"), 1e-9);
        assertTrue(intent.isForceFocus());
        assertEquals(CombatStyle.FORCE, intent.getCombatStyle());
    }

    @Test
    @DisplayName("Should apply class, archetype and mentor signals")
    void shouldApplyClassArchetypeAndMentor() {
        CharacterSnapshot snapshot = gunner.toBuilder()
                .classLevel("soldier", 2)
                .archetype("Sharpshooter")
                .mentorBias("stealth", 5.0)
                .mentorBias("melee", -3.0)
                .build();

        BuildIntent intent = analyzer.analyze(snapshot, PendingSelections.empty());

        assertEquals(0.25, intent.themeScore("combat"), 1e-9);
        assertEquals(0.55, intent.themeScore("ranged"), 1e-9);
        assertEquals(0.25, intent.themeScore("stealth"), 1e-9);
        assertEquals(0.0, intent.themeScore("melee"), 1e-9);
        assertEquals("ranged", intent.getPrimaryThemes().get(0));
        assertEquals(2, intent.getPrimaryThemes().size());
    }

    // =====================================================================
    // Prestige affinity
    // =====================================================================

    @Test
    @DisplayName("Should normalize prestige confidence against 60% of the maximum score")
    void shouldComputeAffinityConfidence() {
        BuildIntent intent = analyzer.analyze(gunner, PendingSelections.empty());

        PrestigeAffinity top = intent.topAffinity().orElseThrow();
        assertEquals("Gunslinger", top.className());
        assertEquals(1, top.score());
        assertEquals(1.0 / (2 * 0.6), top.confidence(), 1e-9);
        assertEquals(List.of("Point-Blank Shot"), top.matches().feats());
        assertTrue(intent.affinityFor("Jedi Knight").isEmpty());
    }

    @Test
    @DisplayName("Should score a matched talent tree with the talent weight")
    void shouldScoreTreeWithTalentWeight() {
        PrestigeSignals forceAdept = new PrestigeSignals("Force Adept", List.of(), List.of(), List.of(),
                List.of("Alter"), List.of(), new SignalWeights(0, 0, 1, 3, 0));
        DefaultBuildIntentAnalyzer treeAnalyzer = new DefaultBuildIntentAnalyzer(List.of(forceAdept), Map.of(),
                ThemeSignals.builder().build(), EngineTuning.defaults());
        CharacterSnapshot adept = CharacterSnapshot.builder().talent("Move Object", "Alter").build();

        PrestigeAffinity top = treeAnalyzer.analyze(adept, PendingSelections.empty()).topAffinity().orElseThrow();

        assertEquals(1, top.score());
        assertEquals(1.0 / (3 * 0.6), top.confidence(), 1e-9);
        assertEquals(List.of("Alter"), top.matches().talentTrees());
    }

    @Test
    @DisplayName("Should list unowned signal feats of prestige targets as priority prerequisites")
    void shouldListPriorityPrerequisites() {
        BuildIntent intent = analyzer.analyze(gunner, PendingSelections.empty());

        PriorityPrerequisite priority = intent.priorityFeat("precise shot").orElseThrow();
        assertEquals("Gunslinger", priority.forClass());
        assertTrue(intent.priorityFeat("Point-Blank Shot").isEmpty());
    }

    @Test
    @DisplayName("Should include pending selections in the analysis")
    void shouldIncludePending() {
        PendingSelections pending = new PendingSelections(
                List.of(OwnedFeature.feat("Precise Shot")), List.of(), List.of(), null, Map.of());

        BuildIntent intent = analyzer.analyze(gunner, pending);

        assertEquals(1.0, intent.topAffinity().orElseThrow().confidence(), 1e-9);
        assertTrue(intent.getPriorityPrerequisites().isEmpty());
    }

    @Test
    @DisplayName("Should return an empty intent for a blank character")
    void shouldHandleBlankCharacter() {
        BuildIntent intent = analyzer.analyze(CharacterSnapshot.builder().build(), PendingSelections.empty());

        assertTrue(intent.getThemes().isEmpty());
        assertTrue(intent.getPrestigeAffinities().isEmpty());
        assertTrue(intent.getPriorityPrerequisites().isEmpty());
    }

    // =====================================================================
    // Alignment checks
    // =====================================================================

    @Test
    @DisplayName("Should align feats by priority, primary theme and combat style")
    void shouldCheckFeatAlignment() {
        BuildIntent intent = analyzer.analyze(gunner, PendingSelections.empty());

        assertEquals("Supports path toward Gunslinger", analyzer.checkFeatAlignment("Precise Shot", intent).reason());
        assertEquals("Aligns with your ranged-focused build", analyzer.checkFeatAlignment("Rapid Shot", intent).reason());
        assertEquals("Supports your ranged combat style", analyzer.checkFeatAlignment("Far Shot", intent).reason());
        assertFalse(analyzer.checkFeatAlignment("Cleave", intent).aligned());
        assertFalse(analyzer.checkFeatAlignment(null, intent).aligned());
    }

    @Test
    @DisplayName("Should align talents by prestige tree or Force focus")
    void shouldCheckTalentAlignment() {
        CharacterSnapshot adept = CharacterSnapshot.builder()
                .feat("Force Sensitivity")
                .talent("Move Object", "Alter")
                .build();
        BuildIntent intent = analyzer.analyze(adept, PendingSelections.empty());

        assertEquals("Supports path toward Jedi Knight",
                analyzer.checkTalentAlignment("Block", "Lightsaber Combat", intent).reason());
        assertEquals("Supports your Force-focused build",
                analyzer.checkTalentAlignment("Telekinetic Power", "Control", intent).reason());
        assertFalse(analyzer.checkTalentAlignment("Knack", "Fortune", intent).aligned());
        assertFalse(analyzer.checkTalentAlignment("Knack", null, intent).aligned());
    }

    @Test
    @DisplayName("Should explain prestige recommendations from matched signals")
    void shouldExplainPrestigeRecommendation() {
        BuildIntent intent = analyzer.analyze(gunner, PendingSelections.empty());

        assertEquals("Builds on your Point-Blank Shot feat(s)",
                analyzer.prestigeRecommendationReason("Gunslinger", intent));
        assertNull(analyzer.prestigeRecommendationReason("Jedi Knight", intent));
    }
}
