package io.scoreline.tx.core.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.scoreline.tx.core.monitor.TransactionEventType.*;
import static org.junit.jupiter.api.Assertions.*;

class TransactionMonitorServiceTest {

    private TransactionMonitorService monitor;
    private TransactionHooks hooks;

    @BeforeEach
    void setUp() {
        monitor = new TransactionMonitorService();
        hooks = monitor.createHooks();
    }

    @Test
    void hooks_recordEventsAndFoldMetrics() {
        replay(committedAfterOneRetry("tx-1", "oracle.updateSnapshot"));

        LabelMetrics metrics = monitor.getMetrics("oracle.updateSnapshot");
        assertEquals(1, metrics.getCount());
        assertEquals(1, metrics.getCommitCount());
        assertEquals(1, metrics.getRollbackCount());
        assertEquals(1, metrics.getRetryCount());
        assertEquals(0, metrics.getFailureCount());
        assertEquals(1, metrics.getCompensationCount());
        assertEquals(0, metrics.getCompensationFailureCount());
        assertEquals(15 + 30, metrics.getTotalDurationMs());
        assertEquals(6, monitor.getEvents().size());
    }

    @Test
    void statistics_aggregateAcrossLabels() {
        replay(committedAfterOneRetry("tx-1", "a"));
        replay(failed("tx-2", "b"));

        TransactionStatistics stats = monitor.getStatistics();

        assertEquals(2, stats.getTotalTransactions());
        assertEquals(1, stats.getSuccessfulTransactions());
        assertEquals(1, stats.getFailedTransactions());
        assertEquals(0, stats.getInFlightTransactions());
        assertEquals(0.5, stats.getSuccessRate(), 0.0001);
        assertEquals(0.5, stats.getRetryRate(), 0.0001);
        assertEquals((15 + 30 + 20) / 2.0, stats.getAverageDurationMs(), 0.0001);
        assertEquals(2, stats.getTotalCompensations());
        assertEquals(1, stats.getTotalTimeouts());
    }

    @Test
    void statistics_countInFlightTransactions() {
        hooks.onBegin(event(BEGIN, "tx-9", "open", 1).build());

        TransactionStatistics stats = monitor.getStatistics();

        assertEquals(1, stats.getTotalTransactions());
        assertEquals(1, stats.getInFlightTransactions());
    }

    @Test
    void clearHistoryThenReplay_reproducesStatistics() {
        List<TransactionEvent> sequence = new ArrayList<>();
        sequence.addAll(committedAfterOneRetry("tx-1", "a"));
        sequence.addAll(failed("tx-2", "a"));
        sequence.addAll(committedAfterOneRetry("tx-3", "b"));
        replay(sequence);
        TransactionStatistics before = monitor.getStatistics();

        monitor.clearHistory();
        assertEquals(0, monitor.getStatistics().getTotalTransactions());
        assertTrue(monitor.getEvents().isEmpty());
        assertTrue(monitor.getAllMetrics().isEmpty());

        replay(sequence);
        assertEquals(before, monitor.getStatistics());
    }

    @Test
    void getEvents_filtersByTxIdTypeLabelAndTime() {
        replay(committedAfterOneRetry("tx-1", "a"));
        replay(failed("tx-2", "b"));

        assertEquals(6, monitor.getEvents(EventFilter.all().txId("tx-1")).size());
        assertEquals(2, monitor.getEvents(EventFilter.all().type(ROLLBACK)).size());
        assertEquals(1, monitor.getEvents(EventFilter.all().label("b").type(TIMEOUT)).size());
        assertEquals(2, monitor.getEvents(EventFilter.all().from(1_000).to(1_001)).size());
        assertTrue(monitor.getEvents(EventFilter.all().txId("missing")).isEmpty());
    }

    @Test
    void history_isTrimmedButMetricsAreNot() {
        monitor.setMaxEventsHistory(3);
        replay(committedAfterOneRetry("tx-1", "a"));

        List<TransactionEvent> events = monitor.getEvents();
        assertEquals(3, events.size());
        assertEquals(RETRY, events.get(0).getType());
        assertEquals(COMMIT, events.get(2).getType());
        assertEquals(1, monitor.getMetrics("a").getCommitCount());

        monitor.setMaxEventsHistory(1);
        assertEquals(1, monitor.getEvents().size());
    }

    @Test
    void subscribe_fansOutUntilUnsubscribed() {
        List<TransactionEvent> received = new ArrayList<>();
        Subscription subscription = monitor.subscribe(received::add);
        monitor.subscribe(e -> {
            throw new IllegalStateException("bad listener");
        });

        hooks.onBegin(event(BEGIN, "tx-1", "a", 1).build());
        subscription.close();
        hooks.onCommit(event(COMMIT, "tx-1", "a", 1).durationMs(5L).build());

        assertEquals(1, received.size());
        assertEquals(2, monitor.getEvents().size());
    }

    @Test
    void exportMetrics_containsStatisticsMetricsAndEvents() throws Exception {
        replay(failed("tx-2", "b"));

        MetricsExport export = monitor.exportMetrics();
        assertEquals(1, export.getStatistics().getFailedTransactions());
        assertEquals(1, export.getMetrics().size());
        assertEquals(4, export.getEvents().size());

        JsonNode json = new ObjectMapper().readTree(monitor.exportMetricsJson());
        assertEquals(1, json.path("statistics").path("failedTransactions").asLong());
        assertEquals("b", json.path("metrics").get(0).path("label").asText());
        assertEquals(1, json.path("metrics").get(0).path("failureCount").asLong());
        assertEquals("begin", json.path("events").get(0).path("type").asText());
        assertEquals("price:BTC/USD", json.path("events").get(2).path("operation").asText());
        assertTrue(json.path("events").get(0).path("errorMessage").isMissingNode());
    }

    @Test
    void recordEvent_isSafeForConcurrentWriters() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        monitor.setMaxEventsHistory(100);
        try {
            for (int t = 0; t < threads; t++) {
                String label = "label-" + (t % 2);
                int thread = t;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        String txId = "tx-" + thread + "-" + i;
                        hooks.onBegin(event(BEGIN, txId, label, 1).build());
                        hooks.onCommit(event(COMMIT, txId, label, 1).durationMs(1L).build());
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        TransactionStatistics stats = monitor.getStatistics();
        assertEquals(threads * perThread, stats.getTotalTransactions());
        assertEquals(threads * perThread, stats.getSuccessfulTransactions());
        assertEquals(threads * perThread, monitor.getMetrics("label-0").getCount()
            + monitor.getMetrics("label-1").getCount());
        assertEquals(100, monitor.getEvents().size());
    }

    @Test
    void clearHistory_racingWritersLeavesMetricsMatchingHistory() throws Exception {
        int threads = 4;
        int perThread = 500;
        monitor.setMaxEventsHistory(threads * perThread * 2);
        ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch writersDone = new CountDownLatch(threads);
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                pool.submit(() -> {
                    start.await();
                    try {
                        for (int i = 0; i < perThread; i++) {
                            String txId = "tx-" + thread + "-" + i;
                            hooks.onBegin(event(BEGIN, txId, "race", 1).build());
                            hooks.onRollback(event(ROLLBACK, txId, "race", 1).durationMs(2L).build());
                        }
                    } finally {
                        writersDone.countDown();
                    }
                    return null;
                });
            }
            pool.submit(() -> {
                start.await();
                while (writersDone.getCount() > 0) {
                    monitor.clearHistory();
                    Thread.yield();
                }
                return null;
            });
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        TransactionMonitorService rebuilt = new TransactionMonitorService();
        TransactionHooks rebuiltHooks = rebuilt.createHooks();
        for (TransactionEvent event : monitor.getEvents()) {
            rebuiltHooks.dispatch(event);
        }
        assertEquals(rebuilt.getStatistics(), monitor.getStatistics());
    }

    private void replay(List<TransactionEvent> events) {
        for (TransactionEvent event : events) {
            hooks.dispatch(event);
        }
    }

    private static List<TransactionEvent> committedAfterOneRetry(String txId, String label) {
        return List.of(
            event(BEGIN, txId, label, 1).timestampMs(1_000).build(),
            event(COMPENSATE, txId, label, 1).operation("snapshot").build(),
            event(ROLLBACK, txId, label, 1).durationMs(15L).errorMessage("deadlock").build(),
            event(RETRY, txId, label, 1).durationMs(100L).errorMessage("deadlock").build(),
            event(BEGIN, txId, label, 2).build(),
            event(COMMIT, txId, label, 2).durationMs(30L).build()
        );
    }

    private static List<TransactionEvent> failed(String txId, String label) {
        return List.of(
            event(BEGIN, txId, label, 1).timestampMs(1_001).build(),
            event(TIMEOUT, txId, label, 1).durationMs(20L).build(),
            event(COMPENSATE, txId, label, 1).operation("price:BTC/USD").errorMessage("row locked").build(),
            event(ROLLBACK, txId, label, 1).durationMs(20L).errorMessage("timed out").build()
        );
    }

    private static TransactionEvent.Builder event(TransactionEventType type, String txId, String label, int attempt) {
        return TransactionEvent.builder(type).txId(txId).label(label).attempt(attempt).timestampMs(5_000);
    }
}
