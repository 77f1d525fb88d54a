package io.scoreline.tx.core.monitor;

/**
 * Handle returned by {@link TransactionMonitorService#subscribe}. Closing it
 * removes the listener.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
