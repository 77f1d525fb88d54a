package io.scoreline.tx.core.exception;

/**
 * Thrown by the transaction manager once an attempt failed terminally, either
 * because retries were exhausted or because the error was not retryable.
 * The cause is always the original error that triggered the last rollback,
 * never a compensation failure.
 */
public class TransactionFailedException extends RuntimeException {

    private final String txId;
    private final String label;
    private final int attempts;
    private final String failedOperation;
    private final int compensatedOperations;
    private final int failedCompensations;
    private final boolean retryable;

    public TransactionFailedException(Throwable cause, String txId, String label, int attempts,
                                      String failedOperation, int compensatedOperations,
                                      int failedCompensations, boolean retryable) {
        super(buildMessage(cause, label, attempts, failedOperation), cause);
        this.txId = txId;
        this.label = label;
        this.attempts = attempts;
        this.failedOperation = failedOperation;
        this.compensatedOperations = compensatedOperations;
        this.failedCompensations = failedCompensations;
        this.retryable = retryable;
    }

    private static String buildMessage(Throwable cause, String label, int attempts, String failedOperation) {
        StringBuilder sb = new StringBuilder("Transaction '").append(label).append("' failed after ")
            .append(attempts).append(attempts == 1 ? " attempt" : " attempts");
        if (failedOperation != null) {
            sb.append(" at operation ").append(failedOperation);
        }
        sb.append(": ").append(cause.getMessage());
        return sb.toString();
    }

    public String getTxId() {
        return txId;
    }

    public String getLabel() {
        return label;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getFailedOperation() {
        return failedOperation;
    }

    public int getCompensatedOperations() {
        return compensatedOperations;
    }

    public int getFailedCompensations() {
        return failedCompensations;
    }

    /**
     * True when the original error was transient, i.e. the transaction failed
     * because retries ran out rather than because the request was invalid.
     */
    public boolean isRetryable() {
        return retryable;
    }

    public boolean isPartialCompensation() {
        return failedCompensations > 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString());
        sb.append(" [txId=").append(txId);
        sb.append(", attempts=").append(attempts);
        sb.append(", compensated=").append(compensatedOperations);
        sb.append(", failedCompensations=").append(failedCompensations);
        sb.append("]");
        return sb.toString();
    }
}
