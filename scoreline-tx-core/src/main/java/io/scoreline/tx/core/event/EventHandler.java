package io.scoreline.tx.core.event;

@FunctionalInterface
public interface EventHandler<E extends DomainEvent> {

    void handle(E event);
}
