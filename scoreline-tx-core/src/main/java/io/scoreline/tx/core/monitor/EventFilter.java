package io.scoreline.tx.core.monitor;

/**
 * Criteria for {@link TransactionMonitorService#getEvents(EventFilter)}.
 * Unset criteria match everything; time bounds are inclusive.
 */
public final class EventFilter {

    private String txId;
    private String label;
    private TransactionEventType type;
    private Long fromTimestampMs;
    private Long toTimestampMs;

    public static EventFilter all() {
        return new EventFilter();
    }

    public EventFilter txId(String txId) {
        this.txId = txId;
        return this;
    }

    public EventFilter label(String label) {
        this.label = label;
        return this;
    }

    public EventFilter type(TransactionEventType type) {
        this.type = type;
        return this;
    }

    public EventFilter from(long timestampMs) {
        this.fromTimestampMs = timestampMs;
        return this;
    }

    public EventFilter to(long timestampMs) {
        this.toTimestampMs = timestampMs;
        return this;
    }

    public boolean matches(TransactionEvent event) {
        if (txId != null && !txId.equals(event.getTxId())) {
            return false;
        }
        if (label != null && !label.equals(event.getLabel())) {
            return false;
        }
        if (type != null && type != event.getType()) {
            return false;
        }
        if (fromTimestampMs != null && event.getTimestampMs() < fromTimestampMs) {
            return false;
        }
        return toTimestampMs == null || event.getTimestampMs() <= toTimestampMs;
    }
}
