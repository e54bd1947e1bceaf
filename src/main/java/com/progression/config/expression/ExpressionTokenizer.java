package com.progression.config.expression;

import com.progression.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

import static com.progression.config.expression.ExpressionConfig.*;

/**
 * Tokenizer for trigger expressions.
 * Converts input string into a sequence of tokens.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, terminated by EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", start));
                }
                case Operators.COMMA -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", start));
                }
                case Operators.AMPERSAND -> {
                    advance();
                    if (!match(Operators.AMPERSAND)) {
                        throw error("Expected '&&'", start);
                    }
                    tokens.add(new Token(TokenType.AND, "&&", start));
                }
                case Operators.PIPE -> {
                    advance();
                    if (!match(Operators.PIPE)) {
                        throw error("Expected '||'", start);
                    }
                    tokens.add(new Token(TokenType.OR, "||", start));
                }
                case Operators.BANG -> {
                    advance();
                    tokens.add(new Token(TokenType.NOT, "!", start));
                }
                case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (Character.isDigit(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", pos));
        return tokens;
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        TokenType keywordType = KEYWORDS.get(text.toUpperCase());
        if (keywordType != null) {
            return new Token(keywordType, text, start);
        }
        return new Token(TokenType.IDENT, text, start);
    }

    private Token readNumber() {
        int start = pos;
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        String text = input.substring(start, pos);
        try {
            Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
        return new Token(TokenType.NUMBER, text, start);
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == Operators.BACKSLASH && !isAtEnd()) {
                sb.append(advance());
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, sb.toString(), start);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == Operators.UNDERSCORE;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ConfigurationException error(String message, int position) {
        return new ConfigurationException("Invalid trigger at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
