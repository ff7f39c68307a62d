package com.listquery.expression;

/**
 * Token types produced by the filter lexer.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    NUMBER,

    // Connectives
    AND,
    OR,

    // Comparators
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,

    // Special
    EOF;

    public boolean isComparator() {
        return switch (this) {
            case EQ, NE, GT, GTE, LT, LTE -> true;
            default -> false;
        };
    }

    public boolean isConnective() {
        return this == AND || this == OR;
    }

    public boolean isLiteral() {
        return this == STRING || this == NUMBER;
    }
}
