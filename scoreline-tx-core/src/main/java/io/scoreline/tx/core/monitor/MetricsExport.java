package io.scoreline.tx.core.monitor;

import java.util.List;

/**
 * Structured dump of the monitor state.
 */
public final class MetricsExport {

    private final TransactionStatistics statistics;
    private final List<LabelMetrics> metrics;
    private final List<TransactionEvent> events;

    public MetricsExport(TransactionStatistics statistics, List<LabelMetrics> metrics, List<TransactionEvent> events) {
        this.statistics = statistics;
        this.metrics = List.copyOf(metrics);
        this.events = List.copyOf(events);
    }

    public TransactionStatistics getStatistics() { return statistics; }
    public List<LabelMetrics> getMetrics() { return metrics; }
    public List<TransactionEvent> getEvents() { return events; }
}
