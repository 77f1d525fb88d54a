package io.scoreline.tx.core.transaction;

import io.scoreline.tx.core.store.IsolationLevel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionOptionsTest {

    @Test
    void defaults_matchDocumentedValues() {
        ExecutionOptions options = ExecutionOptions.defaults();

        assertEquals(3, options.getMaxRetries());
        assertEquals(100, options.getRetryDelayMs());
        assertTrue(options.isExponentialBackoff());
        assertEquals(10_000, options.getMaxBackoffMs());
        assertEquals(30_000, options.getTimeoutMs());
        assertEquals(IsolationLevel.READ_COMMITTED, options.getIsolationLevel());
        assertFalse(options.isReadOnly());
        assertTrue(options.hasTimeout());
    }

    @Test
    void backoffDelay_doublesUpToCap() {
        ExecutionOptions options = ExecutionOptions.builder().retryDelayMs(100).maxBackoffMs(1_000).build();

        assertEquals(100, options.backoffDelayMs(1));
        assertEquals(200, options.backoffDelayMs(2));
        assertEquals(400, options.backoffDelayMs(3));
        assertEquals(800, options.backoffDelayMs(4));
        assertEquals(1_000, options.backoffDelayMs(5));
        assertEquals(1_000, options.backoffDelayMs(80));
    }

    @Test
    void backoffDelay_isConstantWithoutExponential() {
        ExecutionOptions options = ExecutionOptions.builder().retryDelayMs(250).exponentialBackoff(false).build();

        assertEquals(250, options.backoffDelayMs(1));
        assertEquals(250, options.backoffDelayMs(6));
    }

    @Test
    void backoffDelay_rejectsAttemptZero() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.defaults().backoffDelayMs(0));
    }

    @Test
    void nonPositiveTimeout_disablesDeadline() {
        assertFalse(ExecutionOptions.builder().timeoutMs(0).build().hasTimeout());
        assertFalse(ExecutionOptions.builder().timeoutMs(-1).build().hasTimeout());
    }

    @Test
    void toBuilder_copiesEverything() {
        ExecutionOptions original = ExecutionOptions.builder()
            .label("oracle.getLatest")
            .maxRetries(1)
            .isolationLevel(IsolationLevel.SERIALIZABLE)
            .readOnly(true)
            .build();

        ExecutionOptions copy = original.toBuilder().maxRetries(5).build();

        assertEquals("oracle.getLatest", copy.getLabel());
        assertEquals(5, copy.getMaxRetries());
        assertEquals(IsolationLevel.SERIALIZABLE, copy.getIsolationLevel());
        assertTrue(copy.isReadOnly());
        assertEquals(1, original.getMaxRetries());
    }

    @Test
    void build_rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().label("").build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().retryDelayMs(-5).build());
        assertThrows(IllegalArgumentException.class, () -> ExecutionOptions.builder().isolationLevel(null).build());
    }
}
