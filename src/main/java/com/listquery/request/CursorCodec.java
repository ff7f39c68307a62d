package com.listquery.request;

import com.listquery.exception.InvalidCursorException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

/**
 * Encodes pagination cursors as Base64 of {@code "<uuid>;<serial>"}.
 */
public final class CursorCodec {

    /**
     * Separator between id and serial inside the token.
     */
    public static final String DATA_SEPARATOR = ";";

    private CursorCodec() {
    }

    public static String encode(UUID id, long serial) {
        String payload = id + DATA_SEPARATOR + serial;
        return Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.UTF_8));
    }

    public static String encode(Cursor cursor) {
        return encode(cursor.id(), cursor.serial());
    }

    /**
     * Decode a cursor token.
     *
     * @throws InvalidCursorException if the token is not Base64, has the wrong shape,
     *                                or carries an invalid serial or UUID
     */
    public static Cursor decode(String token) {
        if (token == null || token.isEmpty()) {
            throw new InvalidCursorException("Cursor token is empty");
        }

        String payload;
        try {
            payload = new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("Cursor token is not Base64: " + token, e);
        }

        String[] parts = payload.split(DATA_SEPARATOR, -1);
        if (parts.length != 2) {
            throw new InvalidCursorException("Cursor token must hold an id and a serial");
        }

        long serial;
        try {
            serial = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            throw new InvalidCursorException("Invalid cursor serial: " + parts[1], e);
        }

        UUID id;
        try {
            id = UUID.fromString(parts[0]);
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("Invalid cursor id: " + parts[0], e);
        }

        return new Cursor(id, serial);
    }

    /**
     * Build the next and previous tokens of a page.
     * Both are empty when the page is empty or shorter than the limit.
     *
     * @param size  rows in the current page
     * @param limit requested page size
     * @param first first row of the page, ignored when there are no more pages
     * @param last  last row of the page, ignored when there are no more pages
     */
    public static PageTokens tokens(int size, int limit, Cursor first, Cursor last) {
        if (size == 0 || size < limit) {
            return PageTokens.none();
        }
        return new PageTokens(encode(last), encode(first));
    }
}
