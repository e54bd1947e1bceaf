package com.progression.config.expression;

import com.progression.condition.AllOf;
import com.progression.condition.AnyOf;
import com.progression.condition.ClassLevelMinimum;
import com.progression.condition.Condition;
import com.progression.condition.FeatureOwned;
import com.progression.condition.Not;
import com.progression.condition.SkillTrained;
import com.progression.condition.TalentsFromTree;
import com.progression.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

import static com.progression.config.expression.ExpressionConfig.*;

/**
 * Parser for trigger expressions.
 * Converts tokens into a Condition tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('OR' and)*
 * and        := not ('AND' not)*
 * not        := 'NOT' not | primary
 * primary    := '(' expression ')' | predicate
 * predicate  := IDENT '(' argument (',' argument)* ')'
 * </pre>
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a Condition tree.
     *
     * @return Root condition
     */
    public Condition parse() {
        Condition result = parseExpression();
        expect(TokenType.EOF);
        return result;
    }

    private Condition parseExpression() {
        return parseOr();
    }

    private Condition parseOr() {
        Condition left = parseAnd();
        List<Condition> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.OR)) {
            conditions.add(parseAnd());
        }

        return conditions.size() == 1 ? left : new AnyOf(conditions);
    }

    private Condition parseAnd() {
        Condition left = parseNot();
        List<Condition> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.AND)) {
            conditions.add(parseNot());
        }

        return conditions.size() == 1 ? left : new AllOf(conditions);
    }

    private Condition parseNot() {
        if (match(TokenType.NOT)) {
            return new Not(parseNot());
        }
        return parsePrimary();
    }

    private Condition parsePrimary() {
        if (match(TokenType.LPAREN)) {
            Condition expr = parseExpression();
            expect(TokenType.RPAREN);
            return expr;
        }
        return parsePredicate();
    }

    private Condition parsePredicate() {
        Token nameToken = consume(TokenType.IDENT, "Expected predicate");
        Predicate predicate = PREDICATES.get(nameToken.text().toUpperCase());
        if (predicate == null) {
            throw error("Unknown predicate '" + nameToken.text() + "'");
        }

        expect(TokenType.LPAREN);
        List<String> names = new ArrayList<>();
        names.add(parseName());
        Integer count = null;
        while (match(TokenType.COMMA)) {
            if (match(TokenType.NUMBER)) {
                count = previous().count();
            } else {
                names.add(parseName());
            }
        }
        expect(TokenType.RPAREN);

        return switch (predicate) {
            case HAS_FEAT -> single(names, predicate, FeatureOwned.feat(names.get(0)));
            case HAS_TALENT -> single(names, predicate, FeatureOwned.talent(names.get(0)));
            case HAS_FEATURE -> single(names, predicate, FeatureOwned.any(names.get(0)));
            case HAS_ANY_FEAT -> new AnyOf(names.stream().<Condition>map(FeatureOwned::feat).toList());
            case HAS_ANY_TALENT -> new AnyOf(names.stream().<Condition>map(FeatureOwned::talent).toList());
            case HAS_SKILL -> single(names, predicate, new SkillTrained(names.get(0)));
            case HAS_CLASS -> single(names, predicate,
                    new ClassLevelMinimum(names.get(0), count == null ? 1 : count));
            case HAS_TREE -> single(names, predicate,
                    new TalentsFromTree(names.get(0), count == null ? 1 : count));
        };
    }

    private Condition single(List<String> names, Predicate predicate, Condition condition) {
        if (names.size() != 1) {
            throw error(predicate + " takes exactly one name");
        }
        return condition;
    }

    private String parseName() {
        if (match(TokenType.STRING)) {
            return previous().text();
        }
        throw error("Expected quoted name");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().is(TokenType.EOF);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ConfigurationException error(String message) {
        int position = peek().position();
        return new ConfigurationException("Invalid trigger at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
