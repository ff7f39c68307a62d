package com.listquery.validation;

import com.listquery.model.ColumnAllowList;
import com.listquery.model.SortDirection;
import com.listquery.model.SortExpression;
import com.listquery.model.SortKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SortValidator.
 */
class SortValidatorTest {

    private static final ColumnAllowList COLUMNS = ColumnAllowList.of(
            "id", "first_name", "last_name", "email", "created_at", "updated_at");

    @Test
    @DisplayName("Empty sort expression is valid")
    void emptyIsValid() {
        assertTrue(SortValidator.isValid(COLUMNS, ""));
        assertTrue(SortValidator.parse(COLUMNS, "").isEmpty());
    }

    @Test
    @DisplayName("Parse yields keys in client order")
    void parseKeys() {
        SortExpression sort = SortValidator.parse(COLUMNS, "created_at desc,  first_name ASC");

        assertEquals(List.of(
                new SortKey("created_at", SortDirection.DESC),
                new SortKey("first_name", SortDirection.ASC)), sort.keys());
        assertEquals("created_at DESC, first_name ASC", sort.toString());
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @DisplayName("Sort expressions are accepted or rejected with a reason")
    @CsvSource(delimiter = '|', nullValues = "VALID", value = {
            "id ASC, created_at DESC        | VALID",
            "id asc                         | VALID",
            "id\tDESC                       | VALID",
            "'  id   ASC  '                 | VALID",
            "id                             | CARDINALITY_MISMATCH",
            "id ASC, first_name             | CARDINALITY_MISMATCH",
            "id XSC                         | UNKNOWN_DIRECTION",
            "id ASC extra                   | UNKNOWN_DIRECTION",
            "password ASC                   | UNKNOWN_COLUMN",
            "id ASC,                        | UNKNOWN_COLUMN",
            "ID ASC                         | UNKNOWN_COLUMN"
    })
    void sortExpressions(String input, Violation expected) {
        ValidationResult result = SortValidator.validate(COLUMNS, input);

        assertEquals(expected == null, result.isValid());
        assertEquals(expected, result.getViolation());
    }

    @Test
    @DisplayName("Unknown column is reported before a missing direction")
    void columnCheckedFirst() {
        ValidationResult result = SortValidator.validate(COLUMNS, "bogus");

        assertEquals(Violation.UNKNOWN_COLUMN, result.getViolation());
        assertEquals("bogus", result.getToken());
    }

    @Test
    @DisplayName("Column position points at the rejected piece")
    void columnPosition() {
        ValidationResult result = SortValidator.validate(ColumnAllowList.of("created_at"),
                "created_at ASC, created DESC");

        assertEquals(Violation.UNKNOWN_COLUMN, result.getViolation());
        assertEquals("created", result.getToken());
        assertEquals(16, result.getPosition());
    }

    @Test
    @DisplayName("Direction position points at the rejected direction")
    void directionPosition() {
        ValidationResult result = SortValidator.validate(ColumnAllowList.of("id", "a"), "id ASC, a AS");

        assertEquals(Violation.UNKNOWN_DIRECTION, result.getViolation());
        assertEquals("AS", result.getToken());
        assertEquals(10, result.getPosition());
    }

    @Test
    @DisplayName("Empty allow-list rejects sort")
    void emptyAllowList() {
        assertEquals(Violation.EMPTY_ALLOW_LIST,
                SortValidator.validate(ColumnAllowList.of(List.of()), "id ASC").getViolation());
    }
}
