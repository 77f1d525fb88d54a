package io.scoreline.tx.oracle.config;

import io.scoreline.tx.core.store.IsolationLevel;
import io.scoreline.tx.core.transaction.ExecutionOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Oracle settings. Passed to {@link io.scoreline.tx.oracle.service.OracleService}
 * at construction.
 */
@ConfigurationProperties(prefix = "scoreline.oracle")
public class OracleProperties {

    /**
     * Accepted signer (Base64 X.509 Ed25519 public key). Blank accepts any
     * signer whose signature verifies.
     */
    private String signerAddress;
    private long maxClockSkewMs = 120000;
    private Cache cache = new Cache();
    private Transaction transaction = new Transaction();

    public static class Cache {
        private String latestKey = "oracle:latest";
        private long latestTtlSeconds = 60;

        public String getLatestKey() { return latestKey; }
        public void setLatestKey(String latestKey) { this.latestKey = latestKey; }
        public long getLatestTtlSeconds() { return latestTtlSeconds; }
        public void setLatestTtlSeconds(long latestTtlSeconds) { this.latestTtlSeconds = latestTtlSeconds; }
    }

    public static class Transaction {
        private int maxRetries = 3;
        private long retryDelayMs = 100;
        private boolean exponentialBackoff = true;
        private long maxBackoffMs = 5000;
        private long timeoutMs = 30000;
        private IsolationLevel isolationLevel = IsolationLevel.READ_COMMITTED;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
        public boolean isExponentialBackoff() { return exponentialBackoff; }
        public void setExponentialBackoff(boolean exponentialBackoff) { this.exponentialBackoff = exponentialBackoff; }
        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
        public IsolationLevel getIsolationLevel() { return isolationLevel; }
        public void setIsolationLevel(IsolationLevel isolationLevel) { this.isolationLevel = isolationLevel; }
    }

    public ExecutionOptions toExecutionOptions(String label) {
        return ExecutionOptions.builder()
            .label(label)
            .maxRetries(transaction.getMaxRetries())
            .retryDelayMs(transaction.getRetryDelayMs())
            .exponentialBackoff(transaction.isExponentialBackoff())
            .maxBackoffMs(transaction.getMaxBackoffMs())
            .timeoutMs(transaction.getTimeoutMs())
            .isolationLevel(transaction.getIsolationLevel())
            .build();
    }

    public boolean hasSignerAddress() {
        return signerAddress != null && !signerAddress.trim().isEmpty();
    }

    public String getSignerAddress() { return signerAddress; }
    public void setSignerAddress(String signerAddress) { this.signerAddress = signerAddress; }
    public long getMaxClockSkewMs() { return maxClockSkewMs; }
    public void setMaxClockSkewMs(long maxClockSkewMs) { this.maxClockSkewMs = maxClockSkewMs; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Transaction getTransaction() { return transaction; }
    public void setTransaction(Transaction transaction) { this.transaction = transaction; }
}
