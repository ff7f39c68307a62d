package com.listquery.model;

/**
 * Comparison operator of a filter condition.
 * <p>
 * {@link #NOT_EQUAL} is only accepted with a quoted-string literal; numeric literals
 * accept every other comparator.
 */
public enum Comparator {
    EQUAL("="),
    NOT_EQUAL("!="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<=");

    private final String symbol;

    Comparator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Whether this comparator may be followed by a quoted string.
     */
    public boolean acceptsString() {
        return this == EQUAL || this == NOT_EQUAL;
    }

    /**
     * Whether this comparator may be followed by a number.
     */
    public boolean acceptsNumber() {
        return this != NOT_EQUAL;
    }
}
