package com.listquery.request;

import com.listquery.model.FieldsExpression;
import com.listquery.model.FilterExpression;
import com.listquery.model.SortExpression;

import java.util.Optional;

/**
 * Validated list query, ready for the query builder.
 *
 * @param resource Resource name
 * @param sort     Sort keys, empty for no ordering
 * @param filter   Filter conditions, empty for no filtering
 * @param fields   Projection, empty for all columns
 * @param next     Cursor of the next page, null when absent
 * @param prev     Cursor of the previous page, null when absent
 * @param limit    Page size after defaulting and clamping
 */
public record ListQuery(
        String resource,
        SortExpression sort,
        FilterExpression filter,
        FieldsExpression fields,
        Cursor next,
        Cursor prev,
        int limit
) {
    public Optional<Cursor> nextCursor() {
        return Optional.ofNullable(next);
    }

    public Optional<Cursor> prevCursor() {
        return Optional.ofNullable(prev);
    }
}
