package com.progression.config.expression;

import java.util.Map;

/**
 * Keywords, predicate names and operator symbols for trigger expressions.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Keywords mapped to token types. "&&", "||" and "!" are accepted as symbol forms.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT
    );

    /**
     * Snapshot predicates callable from a trigger.
     */
    public enum Predicate {
        /** HAS_FEAT('Pin') */
        HAS_FEAT,
        /** HAS_TALENT('Crush') */
        HAS_TALENT,
        /** HAS_FEATURE('Pin') - feat or talent */
        HAS_FEATURE,
        /** HAS_ANY_FEAT('Double Attack', 'Triple Attack') */
        HAS_ANY_FEAT,
        /** HAS_ANY_TALENT('Ataru', 'Soresu') */
        HAS_ANY_TALENT,
        /** HAS_SKILL('Stealth') - trained */
        HAS_SKILL,
        /** HAS_CLASS('Noble') */
        HAS_CLASS,
        /** HAS_TREE('Lightsaber Combat') - at least one talent from the tree */
        HAS_TREE
    }

    public static final Map<String, Predicate> PREDICATES = Map.of(
            "HAS_FEAT", Predicate.HAS_FEAT,
            "HAS_TALENT", Predicate.HAS_TALENT,
            "HAS_FEATURE", Predicate.HAS_FEATURE,
            "HAS_ANY_FEAT", Predicate.HAS_ANY_FEAT,
            "HAS_ANY_TALENT", Predicate.HAS_ANY_TALENT,
            "HAS_SKILL", Predicate.HAS_SKILL,
            "HAS_CLASS", Predicate.HAS_CLASS,
            "HAS_TREE", Predicate.HAS_TREE
    );

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char COMMA = ',';
        public static final char AMPERSAND = '&';
        public static final char PIPE = '|';
        public static final char BANG = '!';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
