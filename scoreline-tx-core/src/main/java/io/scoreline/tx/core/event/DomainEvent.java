package io.scoreline.tx.core.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base type for business events published after a transaction committed.
 */
public abstract class DomainEvent {

    private final String eventId;
    private final Instant occurredAt;

    protected DomainEvent() {
        this(UUID.randomUUID().toString(), Instant.now());
    }

    protected DomainEvent(String eventId, Instant occurredAt) {
        this.eventId = eventId;
        this.occurredAt = occurredAt;
    }

    /**
     * Stable name of the event kind, e.g. {@code oracle.snapshot.recorded}.
     */
    public abstract String getEventType();

    public String getEventId() {
        return eventId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
