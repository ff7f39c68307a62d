package com.listquery.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Sort direction of a sort key.
 */
public enum SortDirection {
    /**
     * Ascending: lower value first.
     */
    ASC,

    /**
     * Descending: higher value first.
     */
    DESC;

    /**
     * Match a direction keyword, ignoring case.
     *
     * @param text keyword as written by the client
     * @return the direction, or empty if the keyword is not ASC or DESC
     */
    public static Optional<SortDirection> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return switch (text.toUpperCase(Locale.ROOT)) {
            case "ASC" -> Optional.of(ASC);
            case "DESC" -> Optional.of(DESC);
            default -> Optional.empty();
        };
    }
}
