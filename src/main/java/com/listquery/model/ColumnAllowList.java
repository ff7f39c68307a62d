package com.listquery.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable set of column names a resource exposes to one list parameter.
 * Membership is exact and case-sensitive.
 */
public final class ColumnAllowList {

    private static final ColumnAllowList EMPTY = new ColumnAllowList(List.of());

    private final List<String> columns;
    private final Set<String> lookup;

    private ColumnAllowList(List<String> columns) {
        this.columns = List.copyOf(columns);
        this.lookup = Collections.unmodifiableSet(new LinkedHashSet<>(this.columns));
    }

    public static ColumnAllowList of(String... columns) {
        return new ColumnAllowList(List.of(columns));
    }

    public static ColumnAllowList of(List<String> columns) {
        return columns == null || columns.isEmpty() ? EMPTY : new ColumnAllowList(columns);
    }

    public static ColumnAllowList empty() {
        return EMPTY;
    }

    public boolean contains(String column) {
        return column != null && lookup.contains(column);
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    public List<String> columns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnAllowList other)) return false;
        return columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
