package com.listquery.config;

/**
 * Maximum lengths of raw list expressions, checked before any parsing.
 *
 * @param maxFilterLength Maximum filter length in characters
 * @param maxSortLength   Maximum sort length in characters
 * @param maxFieldsLength Maximum fields length in characters
 */
public record LimitsConfig(
        int maxFilterLength,
        int maxSortLength,
        int maxFieldsLength
) {
    public static LimitsConfig defaults() {
        return new LimitsConfig(2048, 1024, 1024);
    }
}
