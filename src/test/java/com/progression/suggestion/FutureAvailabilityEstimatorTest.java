package com.progression.suggestion;

import com.progression.condition.AbilityMinimum;
import com.progression.condition.AllOf;
import com.progression.condition.AnyOf;
import com.progression.condition.AttackBonusMinimum;
import com.progression.condition.ClassLevelMinimum;
import com.progression.condition.Condition;
import com.progression.condition.DroidStatus;
import com.progression.condition.FeatureOwned;
import com.progression.condition.LevelMinimum;
import com.progression.condition.SpeciesMatch;
import com.progression.snapshot.Ability;
import com.progression.snapshot.CharacterSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FutureAvailabilityEstimator.
 */
class FutureAvailabilityEstimatorTest {

    private FutureAvailabilityEstimator estimator;
    private CharacterSnapshot snapshot;

    @BeforeEach
    void setUp() {
        estimator = new FutureAvailabilityEstimator();
        snapshot = CharacterSnapshot.builder()
                .characterLevel(3)
                .baseAttackBonus(2)
                .ability(Ability.DEX, 12)
                .build();
    }

    // =====================================================================
    // Level estimates
    // =====================================================================

    @Test
    @DisplayName("Should estimate levels per threshold condition")
    void shouldEstimateThresholds() {
        assertEquals(4, levels(new AttackBonusMinimum(5)));
        assertEquals(3, levels(new LevelMinimum(6)));
        assertEquals(7, levels(new ClassLevelMinimum("Jedi", 7)));
        assertEquals(8, levels(new AbilityMinimum(Ability.DEX, 14)));
        assertEquals(1, levels(FeatureOwned.feat("Dodge")));
    }

    @Test
    @DisplayName("Should take the largest gap across all unmet conditions")
    void shouldTakeLargestGap() {
        OptionalInt estimate = estimator.estimateLevels(
                List.of(new AttackBonusMinimum(5), new LevelMinimum(6), FeatureOwned.feat("Dodge")), snapshot);

        assertEquals(OptionalInt.of(4), estimate);
        assertEquals(OptionalInt.of(1), estimator.estimateLevels(List.of(), snapshot));
    }

    @Test
    @DisplayName("Should give no estimate when a condition can never be gained")
    void shouldRejectUnobtainableConditions() {
        assertTrue(estimator.estimateLevels(List.of(SpeciesMatch.of("Wookiee")), snapshot).isEmpty());
        assertTrue(estimator.estimateLevels(List.of(DroidStatus.required()), snapshot).isEmpty());
        assertTrue(estimator.estimateLevels(
                List.of(new LevelMinimum(4), SpeciesMatch.of("Wookiee")), snapshot).isEmpty());
    }

    @Test
    @DisplayName("Should estimate OR groups by the cheapest obtainable alternative")
    void shouldEstimateAnyOfByCheapestAlternative() {
        Condition any = new AnyOf(List.of(SpeciesMatch.of("Wookiee"), new LevelMinimum(6), new AttackBonusMinimum(5)));

        assertEquals(3, levels(any));
        assertTrue(estimator.estimateLevels(List.of(new AnyOf(List.of(SpeciesMatch.of("Wookiee")))), snapshot).isEmpty());
    }

    @Test
    @DisplayName("Should estimate nested AND groups from their unmet members only")
    void shouldEstimateAllOfFromUnmetMembers() {
        Condition all = new AllOf(List.of(new LevelMinimum(2), new LevelMinimum(6), new AbilityMinimum(Ability.DEX, 13)));

        assertEquals(4, levels(all));
    }

    // =====================================================================
    // Scale
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should map estimated levels onto the reduced scale")
    @CsvSource({
            "0, 0.6",
            "1, 0.6",
            "2, 0.4",
            "3, 0.2",
            "5, 0.2",
            "6, 0.05",
            "20, 0.05"
    })
    void shouldMapScale(int levels, double expected) {
        assertEquals(expected, FutureAvailabilityEstimator.scale(levels), 1e-9);
    }

    @Test
    @DisplayName("Should build a future suggestion with a class boost")
    void shouldBuildSuggestion() {
        Suggestion plain = estimator.suggest(List.of(new LevelMinimum(4)), snapshot, false);
        Suggestion boosted = estimator.suggest(List.of(new LevelMinimum(4)), snapshot, true);

        assertEquals(ReasonCode.FUTURE_AVAILABLE, plain.reasonCode());
        assertEquals(0.6, plain.tier(), 1e-9);
        assertEquals(0.72, boosted.tier(), 1e-9);
        assertEquals("future_availability:1", plain.sourceId());
        assertEquals("Available in about 1 level", plain.reason());
        assertEquals(TierConfidence.FUTURE_CONFIDENCE, plain.confidence(), 1e-9);
        assertNull(estimator.suggest(List.of(SpeciesMatch.of("Wookiee")), snapshot, true));
    }

    // Helper methods

    private int levels(Condition condition) {
        return estimator.estimateLevels(List.of(condition), snapshot).orElseThrow();
    }
}
