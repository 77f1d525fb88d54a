package io.scoreline.tx.core.transaction;

/**
 * Waits between retry attempts. Replaced in tests to observe backoff delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
