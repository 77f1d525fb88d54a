package io.scoreline.tx.core.event;

import io.scoreline.tx.core.monitor.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process bus. Handlers are matched by event class, including
 * handlers registered for a supertype. A failing handler is logged and does
 * not prevent delivery to the others.
 */
public class SimpleEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(SimpleEventBus.class);

    private final Map<Class<?>, List<EventHandler<? extends DomainEvent>>> handlers = new ConcurrentHashMap<>();

    public <E extends DomainEvent> Subscription subscribe(Class<E> eventType, EventHandler<E> handler) {
        List<EventHandler<? extends DomainEvent>> list =
            handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
        list.add(handler);
        return () -> list.remove(handler);
    }

    @Override
    public void publish(DomainEvent event) {
        int delivered = 0;
        for (Map.Entry<Class<?>, List<EventHandler<? extends DomainEvent>>> entry : handlers.entrySet()) {
            if (!entry.getKey().isInstance(event)) {
                continue;
            }
            for (EventHandler<? extends DomainEvent> handler : entry.getValue()) {
                try {
                    invoke(handler, event);
                    delivered++;
                } catch (RuntimeException e) {
                    log.error("Event handler failed for {} ({})", event.getEventType(), event.getEventId(), e);
                }
            }
        }
        log.debug("Published {} ({}) to {} handler(s)", event.getEventType(), event.getEventId(), delivered);
    }

    @SuppressWarnings("unchecked")
    private static <E extends DomainEvent> void invoke(EventHandler<E> handler, DomainEvent event) {
        handler.handle((E) event);
    }
}
