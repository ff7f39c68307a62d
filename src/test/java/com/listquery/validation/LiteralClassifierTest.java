package com.listquery.validation;

import com.listquery.model.Literal;
import com.listquery.model.LiteralKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LiteralClassifier.
 */
class LiteralClassifierTest {

    @ParameterizedTest
    @DisplayName("Single-quoted tokens are strings")
    @ValueSource(strings = {"'Alice'", "''", "'O'Brien'", "'a b c'"})
    void quotedStrings(String token) {
        assertEquals(LiteralKind.QUOTED_STRING, LiteralClassifier.classify(token).map(Literal::kind).orElseThrow());
    }

    @ParameterizedTest
    @DisplayName("Integers and decimals are numbers")
    @ValueSource(strings = {"0", "42", "-7", "3.14", "1e10", "123456789012345.5"})
    void numbers(String token) {
        assertEquals(LiteralKind.NUMBER, LiteralClassifier.classify(token).map(Literal::kind).orElseThrow());
    }

    @ParameterizedTest
    @DisplayName("Everything else is rejected")
    @ValueSource(strings = {"", "'", "\"Alice\"", "Alice", "'Alice", "Alice'", " 1", "1 ", "1d", "2F", "3L", "1,5"})
    void rejected(String token) {
        assertTrue(LiteralClassifier.classify(token).isEmpty());
        assertFalse(LiteralClassifier.isValue(token));
    }

    @Test
    @DisplayName("Null is rejected without throwing")
    void nullToken() {
        assertFalse(LiteralClassifier.isValue(null));
    }
}
