package com.progression.config;

import com.progression.condition.AllOf;
import com.progression.condition.AnyOf;
import com.progression.condition.ClassLevelMinimum;
import com.progression.condition.Condition;
import com.progression.condition.EvaluationContext;
import com.progression.condition.FeatureOwned;
import com.progression.condition.Not;
import com.progression.condition.TalentsFromTree;
import com.progression.exception.ConfigurationException;
import com.progression.snapshot.CharacterSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TriggerExpressionParser.
 */
class TriggerExpressionParserTest {

    // =====================================================================
    // Structure
    // =====================================================================

    @Test
    @DisplayName("Should parse a single predicate")
    void shouldParseSinglePredicate() {
        assertEquals(FeatureOwned.feat("Pin"), TriggerExpressionParser.parse("HAS_FEAT(\"Pin\")"));
    }

    @Test
    @DisplayName("Should bind NOT tighter than AND")
    void shouldApplyNotBeforeAnd() {
        Condition condition = TriggerExpressionParser.parse("HAS_FEAT(\"Pin\") AND NOT HAS_TALENT(\"Crush\")");

        AllOf all = assertInstanceOf(AllOf.class, condition);
        assertEquals(FeatureOwned.feat("Pin"), all.conditions().get(0));
        assertEquals(new Not(FeatureOwned.talent("Crush")), all.conditions().get(1));
    }

    @Test
    @DisplayName("Should bind AND tighter than OR")
    void shouldApplyAndBeforeOr() {
        Condition condition = TriggerExpressionParser.parse(
                "HAS_FEAT('A') OR HAS_FEAT('B') AND HAS_FEAT('C')");

        AnyOf any = assertInstanceOf(AnyOf.class, condition);
        assertEquals(2, any.conditions().size());
        assertInstanceOf(AllOf.class, any.conditions().get(1));
    }

    @Test
    @DisplayName("Should respect parentheses and symbolic operators")
    void shouldParseParenthesesAndSymbols() {
        Condition condition = TriggerExpressionParser.parse(
                "(HAS_FEAT('A') || HAS_FEAT('B')) && !HAS_FEAT('C')");

        AllOf all = assertInstanceOf(AllOf.class, condition);
        assertInstanceOf(AnyOf.class, all.conditions().get(0));
        assertInstanceOf(Not.class, all.conditions().get(1));
    }

    @Test
    @DisplayName("Should expand HAS_ANY_TALENT into an OR group")
    void shouldParseAnyTalent() {
        Condition condition = TriggerExpressionParser.parse("HAS_ANY_TALENT('Block', 'Deflect')");

        assertEquals(new AnyOf(List.of(FeatureOwned.talent("Block"), FeatureOwned.talent("Deflect"))), condition);
    }

    @Test
    @DisplayName("Should read counts for class and tree predicates")
    void shouldParseCounts() {
        assertEquals(new ClassLevelMinimum("Jedi", 7), TriggerExpressionParser.parse("HAS_CLASS('Jedi', 7)"));
        assertEquals(new TalentsFromTree("Fortune", 2), TriggerExpressionParser.parse("has_tree('Fortune', 2)"));
    }

    @Test
    @DisplayName("Should evaluate a parsed trigger against a character")
    void shouldEvaluateParsedTrigger() {
        Condition trigger = TriggerExpressionParser.parse("HAS_FEAT('Pin') AND NOT HAS_TALENT('Crush')");
        CharacterSnapshot grappler = CharacterSnapshot.builder().feat("Pin").build();
        CharacterSnapshot crusher = grappler.toBuilder().talent("Crush", "Brawler").build();

        assertTrue(trigger.evaluate(EvaluationContext.of(grappler)));
        assertFalse(trigger.evaluate(EvaluationContext.of(crusher)));
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Should reject blank and malformed expressions")
    @ValueSource(strings = {
            "",
            "   ",
            "HAS_FEAT(",
            "HAS_FEAT('Pin'",
            "HAS_FEAT(Pin)",
            "HAS_WINGS('Pin')",
            "HAS_FEAT('Pin') AND",
            "HAS_FEAT('Pin') HAS_FEAT('Cleave')",
            "HAS_FEAT('A', 'B')",
            "HAS_FEAT('Pin') & HAS_FEAT('Cleave')",
            "HAS_FEAT('unterminated)"
    })
    void shouldRejectMalformedExpression(String expression) {
        assertThrows(ConfigurationException.class, () -> TriggerExpressionParser.parse(expression));
    }

    @Test
    @DisplayName("Should reject a null expression")
    void shouldRejectNull() {
        assertThrows(ConfigurationException.class, () -> TriggerExpressionParser.parse(null));
    }
}
