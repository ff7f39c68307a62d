package com.listquery.model;

import java.util.Objects;

/**
 * Right-hand side of a filter condition.
 *
 * @param kind Literal kind
 * @param text Raw text; quoted strings keep their enclosing single quotes
 */
public record Literal(LiteralKind kind, String text) {

    public Literal {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public static Literal quoted(String text) {
        return new Literal(LiteralKind.QUOTED_STRING, text);
    }

    public static Literal number(String text) {
        return new Literal(LiteralKind.NUMBER, text);
    }

    /**
     * String content without the enclosing quotes, with doubled quotes collapsed.
     * Numbers are returned as written.
     */
    public String unquoted() {
        if (kind == LiteralKind.NUMBER) {
            return text;
        }
        return text.substring(1, text.length() - 1).replace("''", "'");
    }

    @Override
    public String toString() {
        return text;
    }
}
