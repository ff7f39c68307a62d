package com.listquery.config;

/**
 * Page size bounds for the limit parameter.
 *
 * @param defaultLimit Limit used when the client sends none or 0
 * @param minLimit     Smallest accepted limit
 * @param maxLimit     Larger limits are clamped to this value
 */
public record PaginationConfig(
        int defaultLimit,
        int minLimit,
        int maxLimit
) {
    public static PaginationConfig defaults() {
        return new PaginationConfig(10, 1, 1000);
    }
}
