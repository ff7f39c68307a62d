package com.listquery.model;

/**
 * One {@code <column> <direction>} token of a sort expression.
 *
 * @param column    Column name
 * @param direction Sort direction
 */
public record SortKey(String column, SortDirection direction) {

    @Override
    public String toString() {
        return column + " " + direction;
    }
}
