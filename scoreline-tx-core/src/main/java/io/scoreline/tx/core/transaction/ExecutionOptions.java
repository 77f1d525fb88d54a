package io.scoreline.tx.core.transaction;

import io.scoreline.tx.core.store.IsolationLevel;

/**
 * Immutable settings for one {@link TransactionManager#execute} call.
 */
public final class ExecutionOptions {

    public static final String DEFAULT_LABEL = "transaction";
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 100;
    public static final long DEFAULT_MAX_BACKOFF_MS = 10_000;
    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    private final String label;
    private final int maxRetries;
    private final long retryDelayMs;
    private final boolean exponentialBackoff;
    private final long maxBackoffMs;
    private final long timeoutMs;
    private final IsolationLevel isolationLevel;
    private final boolean readOnly;

    private ExecutionOptions(Builder builder) {
        this.label = builder.label;
        this.maxRetries = builder.maxRetries;
        this.retryDelayMs = builder.retryDelayMs;
        this.exponentialBackoff = builder.exponentialBackoff;
        this.maxBackoffMs = builder.maxBackoffMs;
        this.timeoutMs = builder.timeoutMs;
        this.isolationLevel = builder.isolationLevel;
        this.readOnly = builder.readOnly;
    }

    public static ExecutionOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Delay before the attempt that follows failed attempt {@code attempt} (1-based):
     * {@code min(retryDelayMs * 2^(attempt-1), maxBackoffMs)} with exponential
     * backoff, otherwise {@code retryDelayMs}.
     */
    public long backoffDelayMs(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was " + attempt);
        }
        if (!exponentialBackoff) {
            return retryDelayMs;
        }
        int shift = Math.min(attempt - 1, 62);
        long factor = 1L << shift;
        if (retryDelayMs > 0 && factor > maxBackoffMs / retryDelayMs) {
            return maxBackoffMs;
        }
        return Math.min(retryDelayMs * factor, maxBackoffMs);
    }

    public boolean hasTimeout() {
        return timeoutMs > 0;
    }

    public String getLabel() { return label; }
    public int getMaxRetries() { return maxRetries; }
    public long getRetryDelayMs() { return retryDelayMs; }
    public boolean isExponentialBackoff() { return exponentialBackoff; }
    public long getMaxBackoffMs() { return maxBackoffMs; }
    public long getTimeoutMs() { return timeoutMs; }
    public IsolationLevel getIsolationLevel() { return isolationLevel; }
    public boolean isReadOnly() { return readOnly; }

    @Override
    public String toString() {
        return "ExecutionOptions{" +
                "label='" + label + '\'' +
                ", maxRetries=" + maxRetries +
                ", retryDelayMs=" + retryDelayMs +
                ", exponentialBackoff=" + exponentialBackoff +
                ", maxBackoffMs=" + maxBackoffMs +
                ", timeoutMs=" + timeoutMs +
                ", isolationLevel=" + isolationLevel +
                ", readOnly=" + readOnly +
                '}';
    }

    public static class Builder {
        private String label = DEFAULT_LABEL;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private boolean exponentialBackoff = true;
        private long maxBackoffMs = DEFAULT_MAX_BACKOFF_MS;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;
        private IsolationLevel isolationLevel = IsolationLevel.READ_COMMITTED;
        private boolean readOnly = false;

        public Builder() {
        }

        public Builder(ExecutionOptions existing) {
            this.label = existing.label;
            this.maxRetries = existing.maxRetries;
            this.retryDelayMs = existing.retryDelayMs;
            this.exponentialBackoff = existing.exponentialBackoff;
            this.maxBackoffMs = existing.maxBackoffMs;
            this.timeoutMs = existing.timeoutMs;
            this.isolationLevel = existing.isolationLevel;
            this.readOnly = existing.readOnly;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder exponentialBackoff(boolean exponentialBackoff) {
            this.exponentialBackoff = exponentialBackoff;
            return this;
        }

        public Builder maxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
            return this;
        }

        /**
         * Per-attempt deadline; zero or negative disables it.
         */
        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder isolationLevel(IsolationLevel isolationLevel) {
            this.isolationLevel = isolationLevel;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public ExecutionOptions build() {
            if (label == null || label.trim().isEmpty()) {
                throw new IllegalArgumentException("label must not be empty");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            if (retryDelayMs < 0 || maxBackoffMs < 0) {
                throw new IllegalArgumentException("retry delays must not be negative");
            }
            if (isolationLevel == null) {
                throw new IllegalArgumentException("isolationLevel must not be null");
            }
            return new ExecutionOptions(this);
        }
    }
}
