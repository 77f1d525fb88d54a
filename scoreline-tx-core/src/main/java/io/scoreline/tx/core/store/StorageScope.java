package io.scoreline.tx.core.store;

import java.util.List;
import java.util.Optional;

/**
 * Handle to one open storage transaction. A scope belongs to exactly one
 * transaction attempt and must not be used after it was committed or rolled back.
 */
public interface StorageScope {

    String getId();

    IsolationLevel getIsolationLevel();

    boolean isReadOnly();

    boolean isActive();

    <T> Optional<T> find(Class<T> type, Object id);

    <T> List<T> findAll(Class<T> type);

    /**
     * Creates a new row; fails if the key is already present.
     */
    <T> T insert(T entity);

    /**
     * Creates the row or replaces the existing one with the same key.
     */
    <T> T upsert(T entity);

    /**
     * Deletes the row if present.
     *
     * @return true if a row was removed, false if there was nothing to delete
     */
    <T> boolean delete(Class<T> type, Object id);
}
