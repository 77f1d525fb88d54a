package io.scoreline.tx.core.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * Records transaction lifecycle events and keeps per-label metrics.
 *
 * <p>The manager reaches the monitor only through the hooks returned by
 * {@link #createHooks()}. Any number of threads may record concurrently.
 */
public class TransactionMonitorService {

    private static final Logger log = LoggerFactory.getLogger(TransactionMonitorService.class);

    public static final int DEFAULT_MAX_EVENTS_HISTORY = 1000;

    private final Map<String, LabelMetrics> metrics = new ConcurrentHashMap<>();
    private final Deque<TransactionEvent> events = new ArrayDeque<>();
    private final Set<Consumer<TransactionEvent>> listeners = new CopyOnWriteArraySet<>();
    private final ObjectMapper objectMapper;
    private volatile int maxEventsHistory;

    public TransactionMonitorService() {
        this(defaultObjectMapper(), DEFAULT_MAX_EVENTS_HISTORY);
    }

    public TransactionMonitorService(ObjectMapper objectMapper, int maxEventsHistory) {
        if (maxEventsHistory < 0) {
            throw new IllegalArgumentException("maxEventsHistory must not be negative");
        }
        this.objectMapper = objectMapper;
        this.maxEventsHistory = maxEventsHistory;
        log.info("TransactionMonitorService initialized (history={})", maxEventsHistory);
    }

    public TransactionHooks createHooks() {
        return new TransactionHooks() {
            @Override
            public void onBegin(TransactionEvent event) {
                recordEvent(event);
                log.debug("Transaction {} [{}] attempt {} beginning",
                    event.getTxId(), event.getLabel(), event.getAttempt());
            }

            @Override
            public void onCommit(TransactionEvent event) {
                recordEvent(event);
                log.debug("Transaction {} [{}] committed in {}ms",
                    event.getTxId(), event.getLabel(), event.getDurationMs());
            }

            @Override
            public void onRollback(TransactionEvent event) {
                recordEvent(event);
                log.debug("Transaction {} [{}] rolled back: {}",
                    event.getTxId(), event.getLabel(), event.getErrorMessage());
            }

            @Override
            public void onCompensate(TransactionEvent event) {
                recordEvent(event);
            }

            @Override
            public void onRetry(TransactionEvent event) {
                recordEvent(event);
                log.debug("Transaction {} [{}] retry scheduled after attempt {}",
                    event.getTxId(), event.getLabel(), event.getAttempt());
            }

            @Override
            public void onTimeout(TransactionEvent event) {
                recordEvent(event);
            }
        };
    }

    public void recordEvent(TransactionEvent event) {
        // metrics and history change together so clearHistory never splits an event
        synchronized (events) {
            metrics.computeIfAbsent(event.getLabel(), LabelMetrics::new).apply(event);
            events.addLast(event);
            trimHistory();
        }

        for (Consumer<TransactionEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Error in transaction event listener for {}", event, e);
            }
        }
    }

    public Subscription subscribe(Consumer<TransactionEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public List<TransactionEvent> getEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public List<TransactionEvent> getEvents(EventFilter filter) {
        List<TransactionEvent> result = new ArrayList<>();
        for (TransactionEvent event : getEvents()) {
            if (filter.matches(event)) {
                result.add(event);
            }
        }
        return result;
    }

    public LabelMetrics getMetrics(String label) {
        return metrics.get(label);
    }

    public List<LabelMetrics> getAllMetrics() {
        return new ArrayList<>(metrics.values());
    }

    public TransactionStatistics getStatistics() {
        long total = 0;
        long successful = 0;
        long failed = 0;
        long duration = 0;
        long retries = 0;
        long compensations = 0;
        long timeouts = 0;
        synchronized (events) {
            for (LabelMetrics m : metrics.values()) {
                total += m.getCount();
                successful += m.getCommitCount();
                failed += m.getFailureCount();
                duration += m.getTotalDurationMs();
                retries += m.getRetryCount();
                compensations += m.getCompensationCount();
                timeouts += m.getTimeoutCount();
            }
        }
        return new TransactionStatistics(total, successful, failed, duration, retries, compensations, timeouts);
    }

    public MetricsExport exportMetrics() {
        return new MetricsExport(getStatistics(), getAllMetrics(), getEvents());
    }

    public String exportMetricsJson() {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(exportMetrics());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transaction metrics", e);
        }
    }

    /**
     * Drops all events and metrics. Listeners stay subscribed.
     */
    public void clearHistory() {
        synchronized (events) {
            events.clear();
            metrics.clear();
        }
        log.debug("Transaction monitor history cleared");
    }

    /**
     * Caps the retained event history, trimming the oldest events right away.
     * Metrics are not affected.
     */
    public void setMaxEventsHistory(int maxEventsHistory) {
        if (maxEventsHistory < 0) {
            throw new IllegalArgumentException("maxEventsHistory must not be negative");
        }
        synchronized (events) {
            this.maxEventsHistory = maxEventsHistory;
            trimHistory();
        }
    }

    public int getMaxEventsHistory() {
        return maxEventsHistory;
    }

    private void trimHistory() {
        while (events.size() > maxEventsHistory) {
            events.removeFirst();
        }
    }

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
