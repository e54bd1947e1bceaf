package com.progression.prerequisite;

import com.progression.condition.AbilityMinimum;
import com.progression.condition.AnyOf;
import com.progression.condition.AttackBonusMinimum;
import com.progression.condition.FeatureOwned;
import com.progression.condition.LevelMinimum;
import com.progression.condition.Not;
import com.progression.condition.TalentsFromTree;
import com.progression.prerequisite.legacy.LegacyPrerequisiteNormalizer;
import com.progression.snapshot.Ability;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.OwnedFeature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultPrerequisiteEvaluator.
 */
class DefaultPrerequisiteEvaluatorTest {

    private DefaultPrerequisiteEvaluator evaluator;
    private CharacterSnapshot soldier;

    @BeforeEach
    void setUp() {
        LegacyPrerequisiteNormalizer normalizer = new LegacyPrerequisiteNormalizer(List.of("Jedi", "Soldier"), List.of("Wookiee"));
        Map<String, List<TalentTreeAccessRule>> access = Map.of(
                "Alter", List.of(new TalentTreeAccessRule(TalentTreeAccessRule.Type.FORCE_GENERIC, null)),
                "Sith Alchemy", List.of(new TalentTreeAccessRule(TalentTreeAccessRule.Type.FORCE_TRADITION, "Sith")),
                "Lightsaber Combat", List.of(new TalentTreeAccessRule(TalentTreeAccessRule.Type.CLASS, null)));
        evaluator = new DefaultPrerequisiteEvaluator(normalizer, access);

        soldier = CharacterSnapshot.builder()
                .characterId("soldier")
                .classLevel("Soldier", 4)
                .baseAttackBonus(4)
                .ability(Ability.STR, 15)
                .ability(Ability.DEX, 12)
                .feat("Power Attack")
                .talent("Devastating Attack", "Weapon Specialist")
                .build();
    }

    // =====================================================================
    // AND sets
    // =====================================================================

    @Test
    @DisplayName("Should satisfy an empty prerequisite set")
    void shouldSatisfyEmptySet() {
        assertTrue(evaluator.evaluate(soldier, PrerequisiteSet.none()).isSatisfied());
        assertTrue(evaluator.evaluate(soldier, null).isSatisfied());
    }

    @Test
    @DisplayName("Should satisfy an AND set only when every condition holds")
    void shouldRequireAllConditions() {
        PrerequisiteSet met = PrerequisiteSet.allOf(
                new AbilityMinimum(Ability.STR, 13), FeatureOwned.feat("Power Attack"), new AttackBonusMinimum(1));
        PrerequisiteSet unmet = PrerequisiteSet.allOf(
                new AbilityMinimum(Ability.STR, 13), new AbilityMinimum(Ability.DEX, 13), new LevelMinimum(6));

        assertTrue(evaluator.evaluate(soldier, met).isSatisfied());

        PrerequisiteResult result = evaluator.evaluate(soldier, unmet);
        assertFalse(result.isSatisfied());
        assertEquals(List.of("Requires DEX 13 (you have 12)", "Requires Character Level 6 (you are level 4)"),
                result.getUnmetReasons());
        assertEquals(2, result.getUnmetConditions().size());
    }

    @Test
    @DisplayName("Should report every unmet condition in an AND set")
    void shouldReportUnmetConditions() {
        PrerequisiteSet set = PrerequisiteSet.allOf(FeatureOwned.feat("Cleave"), new AbilityMinimum(Ability.DEX, 13));

        PrerequisiteResult result = evaluator.evaluate(soldier, set);

        assertFalse(result.isSatisfied());
        assertEquals("Requires Cleave", result.getUnmetReasons().get(0));
        assertEquals("Requires DEX 13 (you have 12)", result.getUnmetReasons().get(1));
    }

    @Test
    @DisplayName("Should honour negated conditions")
    void shouldEvaluateNot() {
        PrerequisiteSet set = PrerequisiteSet.allOf(new Not(FeatureOwned.feat("Power Attack")));

        assertFalse(evaluator.evaluate(soldier, set).isSatisfied());
    }

    // =====================================================================
    // OR sets
    // =====================================================================

    @Test
    @DisplayName("Should satisfy an OR set when any condition holds")
    void shouldSatisfyAnyOf() {
        PrerequisiteSet set = PrerequisiteSet.anyOf(FeatureOwned.feat("Cleave"), FeatureOwned.feat("Power Attack"));

        assertTrue(evaluator.evaluate(soldier, set).isSatisfied());
    }

    @Test
    @DisplayName("Should report a failed OR set as a single group")
    void shouldReportFailedAnyOfAsGroup() {
        PrerequisiteSet set = PrerequisiteSet.anyOf(FeatureOwned.feat("Cleave"), new AbilityMinimum(Ability.DEX, 15));

        PrerequisiteResult result = evaluator.evaluate(soldier, set);

        assertFalse(result.isSatisfied());
        assertEquals(List.of("Requires one of: Cleave or DEX 15"), result.getUnmetReasons());
        assertEquals(1, result.getUnmetConditions().size());
        assertInstanceOf(AnyOf.class, result.getUnmetConditions().get(0));
    }

    // =====================================================================
    // Talent tree counts and legacy text
    // =====================================================================

    @Test
    @DisplayName("Should not count the candidate itself towards its tree")
    void shouldExcludeCandidateFromTreeCount() {
        PrerequisiteSet set = PrerequisiteSet.allOf(new TalentsFromTree("Weapon Specialist", 1));

        assertTrue(evaluator.evaluate(soldier, set, "Penetrating Attack").isSatisfied());
        assertFalse(evaluator.evaluate(soldier, set, "Devastating Attack").isSatisfied());
    }

    @Test
    @DisplayName("Should evaluate free-text prerequisites through the normalizer")
    void shouldEvaluateLegacyText() {
        assertTrue(evaluator.evaluateLegacy(soldier, "Str 13, Power Attack, BAB +1", null).isSatisfied());
        assertTrue(evaluator.evaluateLegacy(soldier, "Soldier 3", null).isSatisfied());
        assertFalse(evaluator.evaluateLegacy(soldier, "Jedi 1", null).isSatisfied());
    }

    // =====================================================================
    // Talent tree access
    // =====================================================================

    @Test
    @DisplayName("Should open force-generic trees to Force-sensitive characters only")
    void shouldGateGenericForceTrees() {
        CharacterSnapshot sensitive = soldier.toBuilder().feat("Force Sensitivity").build();

        assertFalse(evaluator.canAccessTalentTree(soldier, "Alter"));
        assertTrue(evaluator.canAccessTalentTree(sensitive, "alter"));
    }

    @Test
    @DisplayName("Should require tradition membership for tradition trees")
    void shouldGateTraditionTrees() {
        CharacterSnapshot sensitive = soldier.toBuilder().feat("Force Sensitivity").build();
        CharacterSnapshot sith = sensitive.toBuilder()
                .talent(new OwnedFeature(null, "Dark Side Talisman", "Sith", List.of(), "Sith"))
                .build();

        assertFalse(evaluator.canAccessTalentTree(sensitive, "Sith Alchemy"));
        assertTrue(evaluator.canAccessTalentTree(sith, "Sith Alchemy"));
    }

    @Test
    @DisplayName("Should deny class-granted and unknown trees")
    void shouldDenyClassAndUnknownTrees() {
        CharacterSnapshot sensitive = soldier.toBuilder().feat("Force Sensitivity").build();

        assertFalse(evaluator.canAccessTalentTree(sensitive, "Lightsaber Combat"));
        assertFalse(evaluator.canAccessTalentTree(sensitive, "Gunslinger"));
        assertFalse(evaluator.canAccessTalentTree(sensitive, null));
    }
}
