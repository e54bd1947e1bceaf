package com.progression.suggestion;

import com.progression.condition.FeatureOwned;
import com.progression.condition.LevelMinimum;
import com.progression.intent.ClassProfile;
import com.progression.prerequisite.DefaultPrerequisiteEvaluator;
import com.progression.prerequisite.PrerequisiteSet;
import com.progression.prerequisite.legacy.LegacyPrerequisiteNormalizer;
import com.progression.snapshot.Ability;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ClassSuggestionRanker.
 */
class ClassSuggestionRankerTest {

    private ClassSuggestionRanker ranker;
    private Candidate gunslinger;
    private Candidate scout;
    private Candidate soldier;
    private Candidate noble;

    @BeforeEach
    void setUp() {
        LegacyPrerequisiteNormalizer normalizer = new LegacyPrerequisiteNormalizer(List.of("Soldier", "Scout"), List.of());
        Map<String, ClassProfile> profiles = Map.of(
                "Scout", new ClassProfile("Scout", List.of(Ability.DEX), List.of("Perception"),
                        List.of(), List.of(), List.of("Awareness"), "stealth"),
                "Noble", new ClassProfile("Noble", List.of(Ability.CHA, Ability.STR), List.of(),
                        List.of(), List.of(), List.of(), "social"));
        ranker = new ClassSuggestionRanker(new DefaultPrerequisiteEvaluator(normalizer, Map.of()), normalizer, profiles);

        gunslinger = Candidate.characterClass("Gunslinger", ClassCategory.PRESTIGE)
                .prerequisites(PrerequisiteSet.allOf(new LevelMinimum(7), FeatureOwned.feat("Point-Blank Shot")))
                .build();
        scout = Candidate.characterClass("Scout", ClassCategory.BASE).build();
        soldier = Candidate.characterClass("Soldier", ClassCategory.BASE).build();
        noble = Candidate.characterClass("Noble", ClassCategory.BASE).build();
    }

    // =====================================================================
    // Class ladder
    // =====================================================================

    @Test
    @DisplayName("Should rank a prestige class with every prerequisite met as PRESTIGE_NOW")
    void shouldRankPrestigeNow() {
        CharacterSnapshot snapshot = CharacterSnapshot.builder()
                .classLevel("Soldier", 7)
                .feat("Point-Blank Shot")
                .build();

        RankedClass ranked = rankOne(gunslinger, snapshot);

        assertEquals(ReasonCode.PRESTIGE_NOW, ranked.suggestion().reasonCode());
        assertEquals("prestige:Gunslinger", ranked.suggestion().sourceId());
        assertEquals(8, ranked.tierWithBias(), 1e-9);
        assertTrue(ranked.missing().isEmpty());
    }

    @Test
    @DisplayName("Should rank a prestige class missing few verifiable prerequisites as PRESTIGE_SOON")
    void shouldRankPrestigeSoon() {
        CharacterSnapshot snapshot = CharacterSnapshot.builder()
                .classLevel("Soldier", 5)
                .feat("Point-Blank Shot")
                .build();

        RankedClass ranked = rankOne(gunslinger, snapshot);

        assertEquals(ReasonCode.PRESTIGE_SOON, ranked.suggestion().reasonCode());
        assertEquals("Missing only: Character Level 7", ranked.suggestion().reason());
        assertEquals(List.of("Character Level 7"), ranked.missing());
    }

    @Test
    @DisplayName("Should never report PRESTIGE_NOW while unverifiable requirements remain")
    void shouldBlockPrestigeNowOnOtherRequirements() {
        Candidate duelist = Candidate.characterClass("Duelist", ClassCategory.PRESTIGE)
                .otherRequirements(List.of("Must have won a duel"))
                .build();

        RankedClass ranked = rankOne(duelist, CharacterSnapshot.builder().classLevel("Soldier", 7).build());

        assertEquals(ReasonCode.FALLBACK, ranked.suggestion().reasonCode());
        assertEquals(List.of("Must have won a duel"), ranked.missing());
        assertEquals(3, ranked.tierWithBias(), 1e-9);
    }

    @Test
    @DisplayName("Should rank an owned class as a path continuation")
    void shouldRankPathContinuation() {
        RankedClass ranked = rankOne(soldier, CharacterSnapshot.builder().classLevel("soldier", 2).build());

        assertEquals(ReasonCode.PATH_CONTINUATION, ranked.suggestion().reasonCode());
        assertEquals("class:Soldier", ranked.suggestion().sourceId());
        assertEquals("Continue your Soldier progression", ranked.suggestion().reason());
    }

    @Test
    @DisplayName("Should rank a class matching the build mechanically")
    void shouldRankMechanicalSynergy() {
        CharacterSnapshot snapshot = CharacterSnapshot.builder()
                .ability(Ability.DEX, 16)
                .trainedSkill("Perception")
                .build();

        RankedClass ranked = rankOne(scout, snapshot);

        assertEquals(ReasonCode.MECHANICAL_SYNERGY, ranked.suggestion().reasonCode());
        assertEquals("Uses your high Dexterity; Uses trained skills", ranked.suggestion().reason());
    }

    @Test
    @DisplayName("Should rank a weak profile match as thematic")
    void shouldRankThematic() {
        CharacterSnapshot snapshot = CharacterSnapshot.builder()
                .ability(Ability.DEX, 16)
                .ability(Ability.STR, 14)
                .build();

        RankedClass ranked = rankOne(noble, snapshot);

        assertEquals(ReasonCode.THEMATIC, ranked.suggestion().reasonCode());
        assertEquals(1, ClassSuggestionRanker.synergyScore(
                new ClassProfile("Noble", List.of(Ability.CHA, Ability.STR), null, null, null, null, null), snapshot));
    }

    @Test
    @DisplayName("Should fall back for a class without a profile")
    void shouldFallBackWithoutProfile() {
        RankedClass ranked = rankOne(Candidate.characterClass("Scoundrel", ClassCategory.BASE).build(),
                CharacterSnapshot.builder().build());

        assertEquals(ReasonCode.FALLBACK, ranked.suggestion().reasonCode());
        assertEquals(0, ranked.tierWithBias(), 1e-9);
    }

    // =====================================================================
    // Ordering
    // =====================================================================

    @Test
    @DisplayName("Should sort by tier plus category bias")
    void shouldSortByBiasedTier() {
        CharacterSnapshot snapshot = CharacterSnapshot.builder()
                .classLevel("Soldier", 5)
                .feat("Point-Blank Shot")
                .ability(Ability.DEX, 16)
                .trainedSkill("Perception")
                .build();

        List<RankedClass> ranked = ranker.rank(List.of(noble, scout, soldier, gunslinger), snapshot, null);

        assertEquals(List.of("Gunslinger", "Soldier", "Scout", "Noble"),
                ranked.stream().map(r -> r.candidate().getName()).toList());
    }

    @Test
    @DisplayName("Should count the pending class as owned without raising character level")
    void shouldUsePendingClass() {
        CharacterSnapshot snapshot = CharacterSnapshot.builder()
                .classLevel("Soldier", 6)
                .feat("Point-Blank Shot")
                .build();
        PendingSelections pending = new PendingSelections(List.of(), List.of(), List.of(), "Scout", Map.of());

        List<RankedClass> ranked = ranker.rank(List.of(gunslinger, scout), snapshot, pending);

        RankedClass prestige = ranked.stream().filter(r -> r.candidate() == gunslinger).findFirst().orElseThrow();
        RankedClass base = ranked.stream().filter(r -> r.candidate() == scout).findFirst().orElseThrow();
        assertEquals(ReasonCode.PRESTIGE_SOON, prestige.suggestion().reasonCode());
        assertEquals(ReasonCode.PATH_CONTINUATION, base.suggestion().reasonCode());
    }

    // Helper methods

    private RankedClass rankOne(Candidate candidate, CharacterSnapshot snapshot) {
        return ranker.rank(List.of(candidate), snapshot, PendingSelections.empty()).get(0);
    }
}
