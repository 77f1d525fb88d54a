package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.store.StorageScope;

/**
 * Undo action that does not need the forward result.
 */
@FunctionalInterface
public interface ScopeAction {

    void run(StorageScope scope);
}
