package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.store.StorageScope;

/**
 * Forward action of an operation.
 */
@FunctionalInterface
public interface StorageFunction<T> {

    T apply(StorageScope scope);
}
