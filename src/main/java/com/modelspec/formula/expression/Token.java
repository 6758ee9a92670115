package com.modelspec.formula.expression;

/**
 * Represents a token in a formula.
 *
 * @param type     Token type
 * @param text     Original text
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, int position) {

    /**
     * Position just past the end of this token.
     */
    public int end() {
        return position + text.length();
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
