package io.scoreline.tx.core.compensate;

/**
 * Receives the outcome of an operation's forward action. Implemented by the
 * transaction context that the operation was registered with.
 */
public interface OperationListener {

    void onExecuted(CompensatableOperation<?> operation);

    void onFailed(CompensatableOperation<?> operation, Throwable error);
}
