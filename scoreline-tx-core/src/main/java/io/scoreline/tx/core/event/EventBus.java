package io.scoreline.tx.core.event;

import java.util.List;

/**
 * Outbound channel for domain events. Business code publishes after a
 * successful transaction; the transaction manager never publishes itself.
 */
public interface EventBus {

    void publish(DomainEvent event);

    default void publishBatch(List<? extends DomainEvent> events) {
        for (DomainEvent event : events) {
            publish(event);
        }
    }
}
