package io.scoreline.tx.starter.metrics;

import io.scoreline.tx.core.monitor.LabelMetrics;
import io.scoreline.tx.core.monitor.TransactionMonitorService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer bridge for the transaction monitor.
 *
 * Metrics exposed:
 * - scoreline_tx_total{status}            - transactions by outcome
 * - scoreline_tx_success_rate             - committed / total (0..1)
 * - scoreline_tx_duration_avg_ms          - attempt time per transaction
 * - scoreline_tx_retries_total            - retries scheduled
 * - scoreline_tx_compensations_total      - compensation events
 * - scoreline_tx_timeouts_total           - attempts that timed out
 *
 * Gauges read the monitor on scrape, so they always agree with
 * {@link TransactionMonitorService#getStatistics()}.
 */
public class TransactionMonitorMicrometerMetrics {

    private static final Logger log = LoggerFactory.getLogger(TransactionMonitorMicrometerMetrics.class);

    private final MeterRegistry registry;
    private final TransactionMonitorService monitor;

    public TransactionMonitorMicrometerMetrics(MeterRegistry registry, TransactionMonitorService monitor) {
        this.registry = registry;
        this.monitor = monitor;
    }

    @PostConstruct
    public void init() {
        log.info("═══════════════════════════════════════════════════════════");
        log.info("Registering Scoreline TX metrics to Micrometer...");
        log.info("═══════════════════════════════════════════════════════════");

        int before = registry.getMeters().size();

        Gauge.builder("scoreline_tx_total", monitor, m -> m.getStatistics().getTotalTransactions())
            .description("Total transactions started")
            .tag("status", "all")
            .register(registry);

        Gauge.builder("scoreline_tx_total", monitor, m -> m.getStatistics().getSuccessfulTransactions())
            .description("Total committed transactions")
            .tag("status", "committed")
            .register(registry);

        Gauge.builder("scoreline_tx_total", monitor, m -> m.getStatistics().getFailedTransactions())
            .description("Total transactions that exhausted their retries")
            .tag("status", "failed")
            .register(registry);

        Gauge.builder("scoreline_tx_total", monitor, m -> m.getStatistics().getInFlightTransactions())
            .description("Transactions begun but not yet finished")
            .tag("status", "in_flight")
            .register(registry);

        Gauge.builder("scoreline_tx_success_rate", monitor, m -> m.getStatistics().getSuccessRate())
            .description("Transaction success rate (fraction)")
            .register(registry);

        Gauge.builder("scoreline_tx_duration_avg_ms", monitor, m -> m.getStatistics().getAverageDurationMs())
            .description("Average time spent per transaction across attempts (milliseconds)")
            .register(registry);

        Gauge.builder("scoreline_tx_retries_total", monitor, sumOf(LabelMetrics::getRetryCount))
            .description("Retries scheduled")
            .register(registry);

        Gauge.builder("scoreline_tx_compensations_total", monitor, m -> m.getStatistics().getTotalCompensations())
            .description("Compensation events")
            .tag("result", "all")
            .register(registry);

        Gauge.builder("scoreline_tx_compensations_total", monitor, sumOf(LabelMetrics::getCompensationFailureCount))
            .description("Compensations that failed")
            .tag("result", "failed")
            .register(registry);

        Gauge.builder("scoreline_tx_timeouts_total", monitor, m -> m.getStatistics().getTotalTimeouts())
            .description("Attempts that exceeded their timeout")
            .register(registry);

        log.info("✓ Registered {} Scoreline TX metrics", registry.getMeters().size() - before);
        log.info("═══════════════════════════════════════════════════════════");
    }

    private static ToDoubleFunction<TransactionMonitorService> sumOf(ToDoubleFunction<LabelMetrics> field) {
        return m -> m.getAllMetrics().stream().mapToDouble(field).sum();
    }
}
