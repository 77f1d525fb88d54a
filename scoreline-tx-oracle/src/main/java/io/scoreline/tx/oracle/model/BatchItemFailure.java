package io.scoreline.tx.oracle.model;

/**
 * A batch entry that was not applied. {@code index} is the position of the
 * request in the submitted batch.
 */
public final class BatchItemFailure {

    private final int index;
    private final String message;
    private final boolean retryable;

    public BatchItemFailure(int index, String message, boolean retryable) {
        this.index = index;
        this.message = message;
        this.retryable = retryable;
    }

    public int getIndex() { return index; }
    public String getMessage() { return message; }
    public boolean isRetryable() { return retryable; }

    @Override
    public String toString() {
        return "BatchItemFailure{index=" + index + ", retryable=" + retryable + ", message=" + message + "}";
    }
}
