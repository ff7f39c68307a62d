package com.listquery.model;

import java.util.List;

/**
 * Parsed {@code filter} parameter: conditions joined left to right by connectives.
 * There is always exactly one connective fewer than there are conditions.
 *
 * @param conditions  Conditions in client order
 * @param connectives Connectives, {@code connectives[i]} joins conditions i and i+1
 */
public record FilterExpression(List<FilterCondition> conditions, List<Connective> connectives) {

    public FilterExpression {
        conditions = List.copyOf(conditions);
        connectives = List.copyOf(connectives);
        int expected = Math.max(0, conditions.size() - 1);
        if (connectives.size() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " connectives for "
                    + conditions.size() + " conditions but got " + connectives.size());
        }
    }

    public static FilterExpression none() {
        return new FilterExpression(List.of(), List.of());
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    public String toString() {
        if (conditions.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(conditions.get(0).toString());
        for (int i = 0; i < connectives.size(); i++) {
            sb.append(' ').append(connectives.get(i)).append(' ').append(conditions.get(i + 1));
        }
        return sb.toString();
    }
}
