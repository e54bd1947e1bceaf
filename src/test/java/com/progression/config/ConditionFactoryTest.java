package com.progression.config;

import com.progression.condition.AbilityMinimum;
import com.progression.condition.AnyOf;
import com.progression.condition.ClassLevelMinimum;
import com.progression.condition.Condition;
import com.progression.condition.ConditionType;
import com.progression.condition.DroidStatus;
import com.progression.condition.FeatureKind;
import com.progression.condition.FeatureOwned;
import com.progression.condition.Not;
import com.progression.condition.SkillTrained;
import com.progression.condition.SpeciesMatch;
import com.progression.condition.WeaponTraining;
import com.progression.exception.ConfigurationException;
import com.progression.prerequisite.CombinatorMode;
import com.progression.prerequisite.PrerequisiteSet;
import com.progression.snapshot.Ability;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionFactory.
 */
class ConditionFactoryTest {

    // =====================================================================
    // Single conditions
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should resolve type aliases regardless of case and separators")
    @CsvSource({
            "feat, FEATURE_OWNED",
            "TALENT, FEATURE_OWNED",
            "feature, FEATURE_OWNED",
            "skill_trained, SKILL_TRAINED",
            "skill-trained, SKILL_TRAINED",
            "forceSensitive, FORCE_SENSITIVE",
            "isDroid, DROID_STATUS",
            "nonDroid, DROID_STATUS"
    })
    void shouldResolveAliases(String type, ConditionType expected) {
        Condition condition = ConditionFactory.create(Map.of(
                "type", type, "name", "Toughness", "skill", "Pilot"));

        assertEquals(expected, condition.getType());
    }

    @Test
    @DisplayName("Should create feature conditions with the matching kind")
    void shouldCreateFeatureKinds() {
        assertEquals(FeatureKind.FEAT,
                ((FeatureOwned) ConditionFactory.create(Map.of("type", "feat", "name", "Cleave"))).kind());
        assertEquals(FeatureKind.TALENT,
                ((FeatureOwned) ConditionFactory.create(Map.of("type", "talent", "name", "Block"))).kind());
        assertEquals(FeatureKind.ANY,
                ((FeatureOwned) ConditionFactory.create(Map.of("type", "feature", "name", "Block"))).kind());
    }

    @Test
    @DisplayName("Should create threshold and training conditions")
    void shouldCreateThresholds() {
        assertEquals(new AbilityMinimum(Ability.DEX, 13),
                ConditionFactory.create(Map.of("type", "attribute", "ability", "dexterity", "minimum", 13)));
        assertEquals(new ClassLevelMinimum("Jedi", 7),
                ConditionFactory.create(Map.of("type", "classLevel", "className", "Jedi", "minimum", "7")));
        assertEquals(new SkillTrained("Use the Force"),
                ConditionFactory.create(Map.of("type", "skill", "skill", "Use the Force")));
        assertEquals(new WeaponTraining(WeaponTraining.Level.SPECIALIZATION, "Rifles"),
                ConditionFactory.create(Map.of("type", "weaponSpecialization", "group", "Rifles")));
        assertEquals(DroidStatus.excluded(), ConditionFactory.create(Map.of("type", "nonDroid")));
    }

    @Test
    @DisplayName("Should accept one species or a list of species")
    void shouldCreateSpecies() {
        assertEquals(SpeciesMatch.of("Wookiee"),
                ConditionFactory.create(Map.of("type", "species", "name", "Wookiee")));
        assertEquals(new SpeciesMatch(List.of("Human", "Near-Human")),
                ConditionFactory.create(Map.of("type", "species", "names", List.of("Human", "Near-Human"))));
    }

    @Test
    @DisplayName("Should build nested logical conditions")
    void shouldCreateNested() {
        Condition condition = ConditionFactory.create(Map.of(
                "type", "or",
                "conditions", List.of(
                        Map.of("type", "feat", "name", "Cleave"),
                        Map.of("type", "not", "conditions", List.of(Map.of("type", "isDroid"))))));

        AnyOf any = assertInstanceOf(AnyOf.class, condition);
        assertEquals(FeatureOwned.feat("Cleave"), any.conditions().get(0));
        assertEquals(new Not(DroidStatus.required()), any.conditions().get(1));
    }

    // =====================================================================
    // Sets
    // =====================================================================

    @Test
    @DisplayName("Should read a list as an AND set and a map with mode as given")
    void shouldCreateSets() {
        PrerequisiteSet all = ConditionFactory.createSet(List.of(
                Map.of("type", "feat", "name", "Cleave"),
                Map.of("type", "bab", "minimum", 1)));
        PrerequisiteSet any = ConditionFactory.createSet(Map.of(
                "mode", "any",
                "conditions", List.of(Map.of("type", "feat", "name", "Cleave"))));

        assertEquals(CombinatorMode.ALL, all.mode());
        assertEquals(2, all.conditions().size());
        assertEquals(CombinatorMode.ANY, any.mode());
        assertTrue(ConditionFactory.createSet(null).isEmpty());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("Should reject an unknown condition type")
    void shouldRejectUnknownType() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConditionFactory.create(Map.of("type", "hasWings")));

        assertTrue(e.getMessage().contains("hasWings"));
    }

    @Test
    @DisplayName("Should reject missing required fields")
    void shouldRejectMissingFields() {
        assertThrows(ConfigurationException.class, () -> ConditionFactory.create(Map.of("type", "feat")));
        assertThrows(ConfigurationException.class, () -> ConditionFactory.create(Map.of("type", "bab")));
        assertThrows(ConfigurationException.class,
                () -> ConditionFactory.create(Map.of("type", "ability", "ability", "luck", "minimum", 13)));
        assertThrows(ConfigurationException.class, () -> ConditionFactory.create(Map.of("name", "Cleave")));
    }

    @Test
    @DisplayName("Should reject a NOT without exactly one nested condition")
    void shouldRejectInvalidNot() {
        assertThrows(ConfigurationException.class, () -> ConditionFactory.create(Map.of(
                "type", "not",
                "conditions", List.of(Map.of("type", "isDroid"), Map.of("type", "nonDroid")))));
    }

    @Test
    @DisplayName("Should reject a non-numeric minimum")
    void shouldRejectNonNumericMinimum() {
        assertThrows(ConfigurationException.class,
                () -> ConditionFactory.create(Map.of("type", "level", "minimum", "seven")));
    }
}
