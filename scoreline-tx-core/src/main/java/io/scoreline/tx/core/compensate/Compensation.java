package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.store.StorageScope;

/**
 * Undo action of an operation. Receives the scope of the attempt being unwound
 * and the value the forward action returned.
 */
@FunctionalInterface
public interface Compensation<T> {

    void compensate(StorageScope scope, T result);
}
