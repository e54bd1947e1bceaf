package com.progression.config.expression;

/**
 * A lexical unit of a trigger expression.
 * <p>
 * For STRING tokens {@code text} holds the unquoted name; for NUMBER tokens the digits.
 *
 * @param type     Token type
 * @param text     Token text
 * @param position Offset of the first character in the trigger
 */
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Count argument of HAS_CLASS and HAS_TREE.
     */
    public int count() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Not a number token: " + this);
        }
        return Integer.parseInt(text);
    }

    @Override
    public String toString() {
        return type == TokenType.STRING ? type + "(\"" + text + "\")" : type + "(" + text + ")";
    }
}
