package com.listquery.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the boolean facade.
 */
class QueryValidatorsTest {

    // =====================================================================
    // Fields
    // =====================================================================

    @Test
    @DisplayName("Fields: empty, known, unknown and empty allow-list")
    void fields() {
        assertTrue(QueryValidators.isValidFields(List.of("id", "name"), ""));
        assertTrue(QueryValidators.isValidFields(List.of("id", "name"), "id, name"));
        assertFalse(QueryValidators.isValidFields(List.of("id", "name"), "id, bogus"));
        assertFalse(QueryValidators.isValidFields(List.of(), "id"));
    }

    // =====================================================================
    // Sort
    // =====================================================================

    @Test
    @DisplayName("Sort: directions are required and restricted")
    void sort() {
        assertTrue(QueryValidators.isValidSort(List.of("id", "created_at"), "id ASC, created_at DESC"));
        assertFalse(QueryValidators.isValidSort(List.of("id"), "id"));
        assertFalse(QueryValidators.isValidSort(List.of("id"), "id XSC"));
        assertEquals(Violation.UNKNOWN_DIRECTION,
                QueryValidators.validateSort(List.of("id"), "id XSC").getViolation());
    }

    // =====================================================================
    // Filter
    // =====================================================================

    @Test
    @DisplayName("Filter: pairs and connectives must line up")
    void filter() {
        assertTrue(QueryValidators.isValidFilter(List.of("id", "name"), "id=1 AND name='Alice'"));
        assertTrue(QueryValidators.isValidFilter(List.of("id"), "id=1 OR id=2 OR id=3"));
        assertFalse(QueryValidators.isValidFilter(List.of("id"), "id=1 AND"));
        assertFalse(QueryValidators.isValidFilter(List.of("amount"), "amount!=10"));
        assertEquals(Violation.BAD_COMPARATOR,
                QueryValidators.validateFilter(List.of("amount"), "amount!=10").getViolation());
    }

    @Test
    @DisplayName("Null allow-list is treated as empty")
    void nullAllowList() {
        assertFalse(QueryValidators.isValidFields(null, ""));
        assertEquals(Violation.EMPTY_ALLOW_LIST, QueryValidators.validateFields(null, "").getViolation());
    }

    // =====================================================================
    // Purity
    // =====================================================================

    @Test
    @DisplayName("Repeated validation yields the same result")
    void idempotent() {
        List<String> columns = List.of("id", "name");
        String filter = "id=1 AND name='Alice'";

        for (int i = 0; i < 100; i++) {
            assertTrue(QueryValidators.isValidFilter(columns, filter));
            assertFalse(QueryValidators.isValidFilter(columns, "id=1 AND"));
        }
    }

    @Test
    @DisplayName("Random input never throws")
    void randomInputNeverThrows() {
        Random random = new Random(42);
        String alphabet = "abcid_ 01.9'\"=!<>,;()-+ANDORascdesc\t\né☃";
        List<String> columns = List.of("id", "a", "b", "c");

        for (int i = 0; i < 5000; i++) {
            int length = random.nextInt(24);
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < length; j++) {
                sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            String input = sb.toString();

            assertDoesNotThrow(() -> QueryValidators.isValidFilter(columns, input), input);
            assertDoesNotThrow(() -> QueryValidators.isValidSort(columns, input), input);
            assertDoesNotThrow(() -> QueryValidators.isValidFields(columns, input), input);
        }
    }

    @Test
    @DisplayName("Concurrent validation needs no locking")
    void concurrentValidation() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int n = i;
                futures.add(executor.submit(() ->
                        QueryValidators.isValidFilter(List.of("id"), "id=" + n + " OR id=" + (n + 1))
                                && !QueryValidators.isValidSort(List.of("id"), "id")));
            }
            for (Future<Boolean> future : futures) {
                assertTrue(future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
