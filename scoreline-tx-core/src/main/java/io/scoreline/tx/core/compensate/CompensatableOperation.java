package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.exception.CompensationException;
import io.scoreline.tx.core.store.StorageScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * A single reversible step of a transaction: a forward action plus the action
 * that undoes it.
 *
 * <p>The forward action runs at most once. The compensation runs at most once
 * and only if the forward action succeeded. Once registered with a
 * {@link io.scoreline.tx.core.context.TransactionContext}, a successful
 * {@link #execute(StorageScope)} is recorded there so the manager can unwind it.
 */
public abstract class CompensatableOperation<T> {

    private static final Logger log = LoggerFactory.getLogger(CompensatableOperation.class);

    private final String label;
    private final AtomicReference<OperationState> state = new AtomicReference<>(OperationState.PENDING);
    private volatile T result;
    private volatile Throwable failure;
    private volatile OperationListener listener;

    protected CompensatableOperation(String label) {
        if (label == null || label.trim().isEmpty()) {
            throw new IllegalArgumentException("Operation label must not be empty");
        }
        this.label = label;
    }

    public static <T> CompensatableOperation<T> of(String label, StorageFunction<T> forward,
                                                    Compensation<T> compensation) {
        return new CustomOperation<>(label, forward, compensation);
    }

    public static <T> CompensatableOperation<T> of(String label, StorageFunction<T> forward,
                                                    ScopeAction compensation) {
        if (compensation == null) {
            throw new IllegalArgumentException("Compensation must not be null");
        }
        return new CustomOperation<>(label, forward, (scope, ignored) -> compensation.run(scope));
    }

    protected abstract T doExecute(StorageScope scope);

    protected abstract void doCompensate(StorageScope scope, T result);

    /**
     * Binds this operation to the listener that tracks it. An operation can
     * belong to one listener only.
     */
    public final synchronized void attachTo(OperationListener owner) {
        if (listener != null && listener != owner) {
            throw new IllegalStateException("Operation " + label + " is already registered with another transaction");
        }
        if (state.get() != OperationState.PENDING) {
            throw new IllegalStateException("Operation " + label + " cannot be registered in state " + state.get());
        }
        this.listener = owner;
    }

    public final T execute(StorageScope scope) {
        if (!advance(OperationState.EXECUTING)) {
            throw new IllegalStateException("Operation " + label + " was already executed (state " + state.get() + ")");
        }

        T value;
        try {
            value = doExecute(scope);
        } catch (RuntimeException | Error e) {
            failure = e;
            advance(OperationState.FAILED);
            log.debug("Operation {} failed: {}", label, e.getMessage());
            OperationListener owner = listener;
            if (owner != null) {
                owner.onFailed(this, e);
            }
            throw e;
        }

        result = value;
        advance(OperationState.EXECUTED);
        log.debug("Operation {} executed", label);
        OperationListener owner = listener;
        if (owner != null) {
            owner.onExecuted(this);
        }
        return value;
    }

    /**
     * Undoes the forward action. A no-op unless the forward action succeeded
     * and no compensation has run yet.
     *
     * @throws CompensationException if the undo action itself failed
     */
    public final void compensate(StorageScope scope) {
        if (!advance(OperationState.COMPENSATING)) {
            log.trace("Skip compensation of {} in state {}", label, state.get());
            return;
        }
        try {
            doCompensate(scope, result);
            advance(OperationState.COMPENSATED);
            log.debug("Operation {} compensated", label);
        } catch (RuntimeException e) {
            advance(OperationState.COMPENSATION_FAILED);
            throw new CompensationException(label, e);
        }
    }

    private boolean advance(OperationState next) {
        while (true) {
            OperationState current = state.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    public String getLabel() {
        return label;
    }

    public OperationState getState() {
        return state.get();
    }

    public boolean isExecuted() {
        return state.get() == OperationState.EXECUTED;
    }

    public boolean isCompensated() {
        return state.get() == OperationState.COMPENSATED;
    }

    /**
     * Value returned by the forward action, null until it succeeded.
     */
    public T getResult() {
        return result;
    }

    public Throwable getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{label='" + label + "', state=" + state.get() + '}';
    }
}
