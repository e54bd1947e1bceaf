package com.progression.condition;

import com.progression.snapshot.CharacterSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AnyOf and AllOf.
 */
class ConditionGroupTest {

    // Null pattern makes evaluate throw
    private static final Condition BROKEN = new FeaturePattern(null, "broken pattern");

    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        context = new EvaluationContext(CharacterSnapshot.builder().feat("Pin").build(), "Crush");
    }

    @Test
    @DisplayName("Should satisfy an OR group through a healthy sibling of a failing condition")
    void shouldSatisfyAnyOfPastFailure() {
        AnyOf group = new AnyOf(List.of(BROKEN, FeatureOwned.feat("Pin")));

        assertTrue(group.evaluate(context));
        assertFalse(new AnyOf(List.of(BROKEN)).evaluate(context));
    }

    @Test
    @DisplayName("Should count a failing condition in an AND group as unmet")
    void shouldTreatFailureAsUnmetInAllOf() {
        AllOf group = new AllOf(List.of(BROKEN, FeatureOwned.feat("Pin")));

        assertFalse(group.evaluate(context));
        assertEquals("Requires broken pattern", group.unmetReason(context));
    }

    @Test
    @DisplayName("Should treat a failing nested condition as unmet")
    void shouldHoldOnlyEvaluableConditions() {
        assertFalse(context.holds(BROKEN));
        assertTrue(context.holds(FeatureOwned.feat("Pin")));
        assertFalse(context.holds(FeatureOwned.feat("Cleave")));
    }
}
