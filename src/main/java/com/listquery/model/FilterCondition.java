package com.listquery.model;

/**
 * One {@code <column> <comparator> <literal>} pair of a filter expression.
 *
 * @param column     Column name
 * @param comparator Comparison operator
 * @param literal    Literal on the right-hand side
 */
public record FilterCondition(String column, Comparator comparator, Literal literal) {

    @Override
    public String toString() {
        return column + comparator.symbol() + literal.text();
    }
}
