package com.listquery.config;

import com.listquery.model.ColumnAllowList;

/**
 * Allow-lists of one listable resource.
 *
 * @param name   Resource name (e.g., "users")
 * @param fields Columns allowed in the fields parameter
 * @param sort   Columns allowed in the sort parameter
 * @param filter Columns allowed in the filter parameter
 */
public record ResourceConfig(
        String name,
        ColumnAllowList fields,
        ColumnAllowList sort,
        ColumnAllowList filter
) {
    /**
     * Create a resource that exposes the same columns to all three parameters.
     */
    public static ResourceConfig uniform(String name, ColumnAllowList columns) {
        return new ResourceConfig(name, columns, columns, columns);
    }
}
