package com.listquery.request;

import com.listquery.exception.InvalidCursorException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CursorCodec.
 */
class CursorCodecTest {

    private static final UUID ID = UUID.fromString("6f7c13c8-9c6a-432f-a5f6-80a0a1bd29eb");

    private static String base64(String payload) {
        return Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Token is Base64 of id and serial")
    void tokenFormat() {
        assertEquals(base64("6f7c13c8-9c6a-432f-a5f6-80a0a1bd29eb;42"), CursorCodec.encode(ID, 42));
        assertEquals(new Cursor(ID, 42), CursorCodec.decode(base64("6f7c13c8-9c6a-432f-a5f6-80a0a1bd29eb;42")));
    }

    @ParameterizedTest
    @DisplayName("Malformed tokens are rejected")
    @ValueSource(strings = {"", "not base64!", "bm9zZXBhcmF0b3I="})
    void malformedTokens(String token) {
        assertThrows(InvalidCursorException.class, () -> CursorCodec.decode(token));
    }

    @Test
    @DisplayName("Bad serial, bad id and extra parts are rejected")
    void badParts() {
        assertThrows(InvalidCursorException.class, () -> CursorCodec.decode(base64(ID + ";abc")));
        assertThrows(InvalidCursorException.class, () -> CursorCodec.decode(base64("not-a-uuid;1")));
        assertThrows(InvalidCursorException.class, () -> CursorCodec.decode(base64(ID + ";1;2")));
    }

    @Test
    @DisplayName("Full page yields next and prev tokens")
    void fullPage() {
        Cursor first = new Cursor(ID, 1);
        Cursor last = new Cursor(UUID.fromString("00000000-0000-0000-0000-000000000010"), 10);

        PageTokens tokens = CursorCodec.tokens(10, 10, first, last);

        assertTrue(tokens.hasNext());
        assertEquals(last, CursorCodec.decode(tokens.next()));
        assertEquals(first, CursorCodec.decode(tokens.prev()));
    }

    @Test
    @DisplayName("Short or empty page yields no tokens")
    void shortPage() {
        Cursor cursor = new Cursor(ID, 1);

        assertEquals(PageTokens.none(), CursorCodec.tokens(3, 10, cursor, cursor));
        assertEquals(PageTokens.none(), CursorCodec.tokens(0, 10, null, null));
        assertFalse(PageTokens.none().hasNext());
    }
}
