package io.scoreline.tx.core.store;

/**
 * Transactional storage collaborator. The orchestrator only opens, commits and
 * rolls back scopes; all reads and writes go through {@link StorageScope}.
 */
public interface TransactionalStore {

    StorageScope beginTransaction(IsolationLevel isolationLevel, boolean readOnly);

    default StorageScope beginTransaction(IsolationLevel isolationLevel) {
        return beginTransaction(isolationLevel, false);
    }

    void commit(StorageScope scope);

    /**
     * Discards every change made through the scope. Rolling back a scope that
     * is no longer active is a no-op.
     */
    void rollback(StorageScope scope);
}
