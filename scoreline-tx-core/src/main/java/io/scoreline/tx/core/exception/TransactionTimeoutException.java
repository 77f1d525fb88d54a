package io.scoreline.tx.core.exception;

/**
 * The unit of work exceeded its per-attempt deadline. Retryable under the
 * same policy as {@link TransientStorageException}.
 */
public class TransactionTimeoutException extends RuntimeException {

    private final String txId;
    private final long timeoutMs;

    public TransactionTimeoutException(String txId, long timeoutMs) {
        super("Transaction " + txId + " timed out after " + timeoutMs + "ms");
        this.txId = txId;
        this.timeoutMs = timeoutMs;
    }

    public String getTxId() {
        return txId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
