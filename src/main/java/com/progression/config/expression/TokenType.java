package com.progression.config.expression;

/**
 * Token types for trigger expression parsing.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    NUMBER,

    // Delimiters
    LPAREN,
    RPAREN,
    COMMA,

    // Logical operators
    AND,
    OR,
    NOT,

    // Special
    EOF
}
