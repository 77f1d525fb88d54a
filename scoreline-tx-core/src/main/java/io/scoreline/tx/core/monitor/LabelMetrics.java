package io.scoreline.tx.core.monitor;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for all transactions sharing one label. Derived purely from the
 * event stream, so replaying the same events yields the same numbers.
 */
public class LabelMetrics {

    private final String label;

    private final AtomicLong count = new AtomicLong(0);
    private final AtomicLong totalDurationMs = new AtomicLong(0);
    private final AtomicLong retryCount = new AtomicLong(0);
    private final AtomicLong commitCount = new AtomicLong(0);
    private final AtomicLong rollbackCount = new AtomicLong(0);
    private final AtomicLong compensationCount = new AtomicLong(0);
    private final AtomicLong compensationFailureCount = new AtomicLong(0);
    private final AtomicLong timeoutCount = new AtomicLong(0);

    public LabelMetrics(String label) {
        this.label = label;
    }

    void apply(TransactionEvent event) {
        switch (event.getType()) {
            case BEGIN:
                if (event.getAttempt() == 1) {
                    count.incrementAndGet();
                }
                break;
            case COMMIT:
                commitCount.incrementAndGet();
                addDuration(event);
                break;
            case ROLLBACK:
                rollbackCount.incrementAndGet();
                addDuration(event);
                break;
            case COMPENSATE:
                compensationCount.incrementAndGet();
                if (event.isError()) {
                    compensationFailureCount.incrementAndGet();
                }
                break;
            case RETRY:
                retryCount.incrementAndGet();
                break;
            case TIMEOUT:
                timeoutCount.incrementAndGet();
                break;
            default:
                break;
        }
    }

    private void addDuration(TransactionEvent event) {
        if (event.getDurationMs() != null) {
            totalDurationMs.addAndGet(event.getDurationMs());
        }
    }

    public String getLabel() { return label; }
    public long getCount() { return count.get(); }
    public long getTotalDurationMs() { return totalDurationMs.get(); }
    public long getRetryCount() { return retryCount.get(); }
    public long getCommitCount() { return commitCount.get(); }
    public long getRollbackCount() { return rollbackCount.get(); }
    public long getCompensationCount() { return compensationCount.get(); }
    public long getCompensationFailureCount() { return compensationFailureCount.get(); }
    public long getTimeoutCount() { return timeoutCount.get(); }

    /**
     * Transactions that ended in failure: rollbacks not followed by a retry.
     */
    public long getFailureCount() {
        return Math.max(0, rollbackCount.get() - retryCount.get());
    }

    @JsonIgnore
    public double getAverageDurationMs() {
        long total = count.get();
        return total > 0 ? (double) totalDurationMs.get() / total : 0.0;
    }

    @Override
    public String toString() {
        return String.format(
            "LabelMetrics{label=%s, count=%d, commits=%d, failures=%d, retries=%d, " +
            "compensations=%d (%d failed), timeouts=%d, totalDuration=%dms}",
            label, getCount(), getCommitCount(), getFailureCount(), getRetryCount(),
            getCompensationCount(), getCompensationFailureCount(), getTimeoutCount(), getTotalDurationMs()
        );
    }
}
