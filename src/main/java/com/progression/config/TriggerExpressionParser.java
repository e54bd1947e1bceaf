package com.progression.config;

import com.progression.condition.Condition;
import com.progression.config.expression.ExpressionParser;
import com.progression.config.expression.ExpressionTokenizer;
import com.progression.config.expression.Token;
import com.progression.exception.ConfigurationException;

import java.util.List;

/**
 * Facade for parsing synergy trigger expressions into Condition trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: AND, OR, NOT (also &amp;&amp;, ||, !)</li>
 *   <li>Predicates: HAS_FEAT, HAS_TALENT, HAS_FEATURE, HAS_ANY_FEAT, HAS_ANY_TALENT,
 *       HAS_SKILL, HAS_CLASS, HAS_TREE</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: NOT > AND > OR (parentheses override)
 */
public final class TriggerExpressionParser {

    private TriggerExpressionParser() {
    }

    /**
     * Parse a trigger expression into a Condition tree.
     *
     * @param expression Expression string
     * @return Parsed condition
     * @throws ConfigurationException if the expression is blank or malformed
     */
    public static Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Trigger expression is empty");
        }

        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        ExpressionParser parser = new ExpressionParser(expression, tokens);
        return parser.parse();
    }
}
