package io.scoreline.tx.core.context;

import io.scoreline.tx.core.compensate.CompensatableOperation;
import io.scoreline.tx.core.compensate.OperationListener;
import io.scoreline.tx.core.store.StorageScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-attempt bookkeeping handed to the unit of work.
 *
 * <p>A context is created fresh for every attempt and owns the attempt's
 * storage scope. Operations are registered here and, once their forward action
 * succeeds, appended to the executed list that the manager unwinds on failure.
 * When the attempt ends the context is closed and rejects new registrations.
 */
public class TransactionContext implements OperationListener {

    private static final Logger log = LoggerFactory.getLogger(TransactionContext.class);

    private final String txId;
    private final String label;
    private final int attemptNumber;
    private final StorageScope scope;
    private final Instant startTime;

    private final List<CompensatableOperation<?>> registeredOperations = new ArrayList<>();
    private final List<CompensatableOperation<?>> executedOperations = new ArrayList<>();

    private volatile TransactionState state = TransactionState.BEGINNING;
    private volatile String lastFailedOperation;
    private volatile boolean closed = false;

    public TransactionContext(String txId, String label, int attemptNumber, StorageScope scope, Instant startTime) {
        this.txId = txId;
        this.label = label;
        this.attemptNumber = attemptNumber;
        this.scope = scope;
        this.startTime = startTime;
    }

    /**
     * Registers an operation with this attempt. Bookkeeping only: the caller
     * still runs {@link CompensatableOperation#execute(StorageScope)}.
     *
     * @return the same operation, for chaining
     */
    public <T> CompensatableOperation<T> registerOperation(CompensatableOperation<T> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("Operation must not be null");
        }
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Transaction " + txId + " attempt " + attemptNumber
                    + " is closed, cannot register " + operation.getLabel());
            }
            operation.attachTo(this);
            registeredOperations.add(operation);
        }
        log.trace("Registered operation {} in {} (attempt {})", operation.getLabel(), txId, attemptNumber);
        return operation;
    }

    @Override
    public void onExecuted(CompensatableOperation<?> operation) {
        synchronized (this) {
            executedOperations.add(operation);
            if (closed) {
                log.warn("Operation {} completed after transaction {} attempt {} was closed",
                    operation.getLabel(), txId, attemptNumber);
            }
        }
    }

    @Override
    public void onFailed(CompensatableOperation<?> operation, Throwable error) {
        lastFailedOperation = operation.getLabel();
    }

    /**
     * Moves the attempt to the next state. Reaching a terminal state closes
     * the context.
     *
     * @throws IllegalStateException on a transition the state machine does not allow
     */
    public synchronized void transitionTo(TransactionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Invalid transition " + state + " -> " + next + " for " + txId);
        }
        state = next;
        if (next.isTerminal()) {
            closed = true;
        }
    }

    /**
     * Stops accepting registrations. Idempotent.
     */
    public synchronized void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getTxId() {
        return txId;
    }

    public String getLabel() {
        return label;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public StorageScope getScope() {
        return scope;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public TransactionState getState() {
        return state;
    }

    /**
     * Label of the most recent operation whose forward action threw, or null.
     */
    public String getLastFailedOperation() {
        return lastFailedOperation;
    }

    public synchronized List<CompensatableOperation<?>> getRegisteredOperations() {
        return Collections.unmodifiableList(new ArrayList<>(registeredOperations));
    }

    /**
     * Successfully executed operations, in forward order.
     */
    public synchronized List<CompensatableOperation<?>> getExecutedOperations() {
        return Collections.unmodifiableList(new ArrayList<>(executedOperations));
    }

    public synchronized List<CompensatableOperation<?>> getExecutedOperationsInReverseOrder() {
        List<CompensatableOperation<?>> reversed = new ArrayList<>(executedOperations);
        Collections.reverse(reversed);
        return reversed;
    }

    @Override
    public String toString() {
        return "TransactionContext{" +
                "txId='" + txId + '\'' +
                ", label='" + label + '\'' +
                ", attempt=" + attemptNumber +
                ", state=" + state +
                ", executed=" + executedOperations.size() +
                ", closed=" + closed +
                '}';
    }
}
