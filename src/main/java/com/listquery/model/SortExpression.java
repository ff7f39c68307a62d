package com.listquery.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered sort keys from the {@code sort} parameter. Empty means no ordering requested.
 *
 * @param keys Sort keys in client order
 */
public record SortExpression(List<SortKey> keys) {

    public SortExpression {
        keys = List.copyOf(keys);
    }

    public static SortExpression none() {
        return new SortExpression(List.of());
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public String toString() {
        return keys.stream().map(SortKey::toString).collect(Collectors.joining(", "));
    }
}
