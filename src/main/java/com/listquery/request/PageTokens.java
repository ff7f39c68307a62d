package com.listquery.request;

/**
 * Cursor tokens for the neighbouring pages. Empty strings mean there is no such page.
 *
 * @param next Token of the last row of the current page
 * @param prev Token of the first row of the current page
 */
public record PageTokens(String next, String prev) {

    public static PageTokens none() {
        return new PageTokens("", "");
    }

    public boolean hasNext() {
        return !next.isEmpty();
    }
}
