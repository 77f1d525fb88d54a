package io.scoreline.tx.core.compensate;

/**
 * Lifecycle of a single compensatable operation.
 */
public enum OperationState {

    PENDING,

    /**
     * Forward action in progress
     */
    EXECUTING,

    EXECUTED,

    /**
     * Forward action threw; nothing to compensate
     */
    FAILED,

    COMPENSATING,

    COMPENSATED,

    /**
     * Compensation threw; the storage rollback is the last line of defence
     */
    COMPENSATION_FAILED;

    public boolean canTransitionTo(OperationState next) {
        switch (this) {
            case PENDING:
                return next == EXECUTING;
            case EXECUTING:
                return next == EXECUTED || next == FAILED;
            case EXECUTED:
                return next == COMPENSATING;
            case COMPENSATING:
                return next == COMPENSATED || next == COMPENSATION_FAILED;
            default:
                return false;
        }
    }
}
