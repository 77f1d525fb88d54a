package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.exception.CompensationException;
import io.scoreline.tx.core.store.StorageScope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompensatableOperationTest {

    @Mock private StorageScope scope;
    @Mock private OperationListener listener;

    @Test
    void execute_runsForwardOnceAndReportsSuccess() {
        AtomicInteger forwardCalls = new AtomicInteger();
        CompensatableOperation<String> op = CompensatableOperation.of("write",
            s -> "result-" + forwardCalls.incrementAndGet(),
            (s, result) -> { });
        op.attachTo(listener);

        assertEquals("result-1", op.execute(scope));
        assertEquals(OperationState.EXECUTED, op.getState());
        assertEquals("result-1", op.getResult());
        verify(listener).onExecuted(op);

        IllegalStateException again = assertThrows(IllegalStateException.class, () -> op.execute(scope));
        assertTrue(again.getMessage().contains("write"));
        assertEquals(1, forwardCalls.get());
    }

    @Test
    void execute_reportsFailureAndRethrows() {
        RuntimeException boom = new RuntimeException("boom");
        CompensatableOperation<String> op = CompensatableOperation.of("write",
            s -> {
                throw boom;
            },
            (s, result) -> fail("must not compensate a failed forward action"));
        op.attachTo(listener);

        assertSame(boom, assertThrows(RuntimeException.class, () -> op.execute(scope)));
        assertEquals(OperationState.FAILED, op.getState());
        assertSame(boom, op.getFailure());
        verify(listener).onFailed(op, boom);
        verify(listener, never()).onExecuted(any());

        op.compensate(scope);
        assertEquals(OperationState.FAILED, op.getState());
    }

    @Test
    void compensate_isNoOpBeforeExecution() {
        List<String> calls = new ArrayList<>();
        CompensatableOperation<String> op = CompensatableOperation.of("write",
            s -> "x",
            s -> calls.add("undo"));

        op.compensate(scope);

        assertTrue(calls.isEmpty());
        assertEquals(OperationState.PENDING, op.getState());
    }

    @Test
    void compensate_receivesScopeAndForwardResultAndRunsOnce() {
        AtomicReference<StorageScope> seenScope = new AtomicReference<>();
        AtomicReference<Integer> seenResult = new AtomicReference<>();
        AtomicInteger compensations = new AtomicInteger();
        CompensatableOperation<Integer> op = CompensatableOperation.of("count",
            s -> 7,
            (s, result) -> {
                seenScope.set(s);
                seenResult.set(result);
                compensations.incrementAndGet();
            });
        StorageScope otherScope = mock(StorageScope.class);

        op.execute(scope);
        op.compensate(otherScope);
        op.compensate(otherScope);

        assertSame(otherScope, seenScope.get());
        assertEquals(7, seenResult.get());
        assertEquals(1, compensations.get());
        assertTrue(op.isCompensated());
    }

    @Test
    void compensate_wrapsFailureInCompensationException() {
        IllegalStateException cause = new IllegalStateException("row locked");
        CompensatableOperation<String> op = CompensatableOperation.of("price:BTC/USD",
            s -> "x",
            (s, result) -> {
                throw cause;
            });
        op.execute(scope);

        CompensationException ex = assertThrows(CompensationException.class, () -> op.compensate(scope));

        assertEquals("price:BTC/USD", ex.getOperation());
        assertSame(cause, ex.getCause());
        assertEquals(OperationState.COMPENSATION_FAILED, op.getState());
    }

    @Test
    void attachTo_rejectsSecondOwner() {
        CompensatableOperation<String> op = CompensatableOperation.of("write", s -> "x", s -> { });
        op.attachTo(listener);

        assertThrows(IllegalStateException.class, () -> op.attachTo(mock(OperationListener.class)));
    }

    @Test
    void attachTo_rejectsAlreadyExecutedOperation() {
        CompensatableOperation<String> op = CompensatableOperation.of("write", s -> "x", s -> { });
        op.execute(scope);

        assertThrows(IllegalStateException.class, () -> op.attachTo(listener));
    }

    @Test
    void constructor_rejectsBlankLabel() {
        assertThrows(IllegalArgumentException.class,
            () -> CompensatableOperation.of(" ", s -> "x", (s, r) -> { }));
    }

    @Test
    void operationState_allowsOnlyForwardTransitions() {
        assertTrue(OperationState.PENDING.canTransitionTo(OperationState.EXECUTING));
        assertTrue(OperationState.EXECUTED.canTransitionTo(OperationState.COMPENSATING));
        assertFalse(OperationState.FAILED.canTransitionTo(OperationState.COMPENSATING));
        assertFalse(OperationState.COMPENSATED.canTransitionTo(OperationState.COMPENSATING));
        assertFalse(OperationState.COMPENSATION_FAILED.canTransitionTo(OperationState.COMPENSATED));
    }
}
