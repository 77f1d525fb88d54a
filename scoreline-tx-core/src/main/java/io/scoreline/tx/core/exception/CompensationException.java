package io.scoreline.tx.core.exception;

/**
 * A compensating action failed. Logged by the unwind loop and never
 * escalated to the caller of the transaction.
 */
public class CompensationException extends RuntimeException {

    private final String operation;

    public CompensationException(String operation, Throwable cause) {
        super("Compensation for " + operation + " failed: " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
