package io.scoreline.tx.core.context;

/**
 * States of one transaction attempt.
 * A retry starts over in BEGINNING with a fresh context.
 */
public enum TransactionState {

    /**
     * Storage scope opened, work not yet started
     */
    BEGINNING,

    /**
     * Unit of work running
     */
    RUNNING,

    COMMITTING,

    /**
     * Unwinding executed operations in reverse order
     */
    COMPENSATING,

    COMMITTED,

    /**
     * Compensated and rolled back; another attempt follows
     */
    RETRY_SCHEDULED,

    /**
     * Compensated and rolled back; no further attempt
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == RETRY_SCHEDULED || this == FAILED;
    }

    public boolean canTransitionTo(TransactionState next) {
        switch (this) {
            case BEGINNING:
                return next == RUNNING || next == COMPENSATING;
            case RUNNING:
                return next == COMMITTING || next == COMPENSATING;
            case COMMITTING:
                return next == COMMITTED || next == COMPENSATING;
            case COMPENSATING:
                return next == RETRY_SCHEDULED || next == FAILED;
            default:
                return false;
        }
    }
}
