package io.scoreline.tx.core.monitor;

import java.util.Objects;

/**
 * Point-in-time aggregate over all labels. Rates are fractions in [0, 1].
 */
public final class TransactionStatistics {

    private final long totalTransactions;
    private final long successfulTransactions;
    private final long failedTransactions;
    private final long inFlightTransactions;
    private final double successRate;
    private final double averageDurationMs;
    private final double retryRate;
    private final long totalCompensations;
    private final long totalTimeouts;

    public TransactionStatistics(long totalTransactions, long successfulTransactions, long failedTransactions,
                                 long totalDurationMs, long totalRetries, long totalCompensations,
                                 long totalTimeouts) {
        this.totalTransactions = totalTransactions;
        this.successfulTransactions = successfulTransactions;
        this.failedTransactions = failedTransactions;
        this.inFlightTransactions = Math.max(0, totalTransactions - successfulTransactions - failedTransactions);
        this.successRate = totalTransactions > 0 ? (double) successfulTransactions / totalTransactions : 0.0;
        this.averageDurationMs = totalTransactions > 0 ? (double) totalDurationMs / totalTransactions : 0.0;
        this.retryRate = totalTransactions > 0 ? (double) totalRetries / totalTransactions : 0.0;
        this.totalCompensations = totalCompensations;
        this.totalTimeouts = totalTimeouts;
    }

    public long getTotalTransactions() { return totalTransactions; }
    public long getSuccessfulTransactions() { return successfulTransactions; }
    public long getFailedTransactions() { return failedTransactions; }
    public long getInFlightTransactions() { return inFlightTransactions; }
    public double getSuccessRate() { return successRate; }
    public double getAverageDurationMs() { return averageDurationMs; }
    public double getRetryRate() { return retryRate; }
    public long getTotalCompensations() { return totalCompensations; }
    public long getTotalTimeouts() { return totalTimeouts; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionStatistics)) return false;
        TransactionStatistics that = (TransactionStatistics) o;
        return totalTransactions == that.totalTransactions
                && successfulTransactions == that.successfulTransactions
                && failedTransactions == that.failedTransactions
                && inFlightTransactions == that.inFlightTransactions
                && Double.compare(successRate, that.successRate) == 0
                && Double.compare(averageDurationMs, that.averageDurationMs) == 0
                && Double.compare(retryRate, that.retryRate) == 0
                && totalCompensations == that.totalCompensations
                && totalTimeouts == that.totalTimeouts;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalTransactions, successfulTransactions, failedTransactions, inFlightTransactions,
            successRate, averageDurationMs, retryRate, totalCompensations, totalTimeouts);
    }

    @Override
    public String toString() {
        return String.format(
            "TransactionStatistics{total=%d, successful=%d, failed=%d, inFlight=%d, " +
            "successRate=%.2f, avgDuration=%.2fms, retryRate=%.2f, compensations=%d, timeouts=%d}",
            totalTransactions, successfulTransactions, failedTransactions, inFlightTransactions,
            successRate, averageDurationMs, retryRate, totalCompensations, totalTimeouts
        );
    }
}
