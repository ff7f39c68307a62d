package com.listquery.model;

import java.util.List;

/**
 * Projection requested by the {@code fields} parameter.
 * Order is preserved and duplicates are kept. An empty list means no projection.
 *
 * @param columns Trimmed column names
 */
public record FieldsExpression(List<String> columns) {

    public FieldsExpression {
        columns = List.copyOf(columns);
    }

    public static FieldsExpression all() {
        return new FieldsExpression(List.of());
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }
}
