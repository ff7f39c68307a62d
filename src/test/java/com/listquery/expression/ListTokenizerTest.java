package com.listquery.expression;

import com.listquery.expression.ListTokenizer.Piece;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ListTokenizer.
 */
class ListTokenizerTest {

    @Test
    @DisplayName("Fields tokens are trimmed and keep order and duplicates")
    void fieldsTrimmed() {
        assertEquals(List.of(new Piece("id", 1), new Piece("name", 5), new Piece("id", 12)),
                ListTokenizer.tokenizeFields(" id ,name,  id"));
    }

    @Test
    @DisplayName("Empty pieces are kept as empty strings")
    void emptyPiecesKept() {
        assertEquals(List.of(new Piece("id", 0), new Piece("", 4), new Piece("", 5)),
                ListTokenizer.tokenizeFields("id, ,"));
        assertEquals(List.of(new Piece("", 0)), ListTokenizer.tokenizeFields(""));
    }

    @Test
    @DisplayName("Sort tokens are not trimmed")
    void sortUntrimmed() {
        assertEquals(List.of(new Piece("id ASC", 0), new Piece(" name DESC", 7)),
                ListTokenizer.tokenizeSort("id ASC, name DESC"));
    }

    @Test
    @DisplayName("Strip moves the position past leading whitespace")
    void stripPosition() {
        assertEquals(new Piece("name DESC", 8), ListTokenizer.strip(new Piece(" name DESC ", 7)));
    }
}
