package com.listquery.expression;

/**
 * Represents a token in a filter expression.
 *
 * @param type     Token type
 * @param text     Original text, quotes included for strings
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
