package com.listquery.validation;

import com.listquery.model.ColumnAllowList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ColumnGate.
 */
class ColumnGateTest {

    @Test
    @DisplayName("Exact match is allowed")
    void exactMatch() {
        assertTrue(ColumnGate.isAllowed("email", List.of("id", "email")));
        assertTrue(ColumnGate.isAllowed("email", ColumnAllowList.of("id", "email")));
    }

    @Test
    @DisplayName("Case and whitespace differences are not allowed")
    void noFuzzyMatch() {
        assertFalse(ColumnGate.isAllowed("Email", List.of("id", "email")));
        assertFalse(ColumnGate.isAllowed(" email", ColumnAllowList.of("id", "email")));
        assertFalse(ColumnGate.isAllowed("", ColumnAllowList.of("id", "email")));
    }

    @Test
    @DisplayName("Null name or allow-list is not allowed")
    void nulls() {
        assertFalse(ColumnGate.isAllowed(null, List.of("id")));
        assertFalse(ColumnGate.isAllowed("id", (List<String>) null));
        assertFalse(ColumnGate.isAllowed("id", (ColumnAllowList) null));
    }
}
