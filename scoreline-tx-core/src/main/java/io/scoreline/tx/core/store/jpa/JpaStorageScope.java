package io.scoreline.tx.core.store.jpa;

import io.scoreline.tx.core.store.IsolationLevel;
import io.scoreline.tx.core.store.StorageScope;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.criteria.CriteriaQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Scope over one entity manager and its resource-local transaction. Writes are
 * flushed immediately so constraint violations surface inside the operation
 * that caused them.
 */
public class JpaStorageScope implements StorageScope {

    private static final Logger log = LoggerFactory.getLogger(JpaStorageScope.class);

    private final String id;
    private final EntityManager entityManager;
    private final EntityTransaction transaction;
    private final IsolationLevel isolationLevel;
    private final boolean readOnly;
    private volatile boolean closed = false;

    JpaStorageScope(String id, EntityManager entityManager, EntityTransaction transaction,
                    IsolationLevel isolationLevel, boolean readOnly) {
        this.id = id;
        this.entityManager = entityManager;
        this.transaction = transaction;
        this.isolationLevel = isolationLevel;
        this.readOnly = readOnly;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public IsolationLevel getIsolationLevel() {
        return isolationLevel;
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public boolean isActive() {
        return !closed && transaction.isActive();
    }

    /**
     * The underlying entity manager, for queries the scope API does not cover.
     */
    public EntityManager getEntityManager() {
        return entityManager;
    }

    @Override
    public <T> Optional<T> find(Class<T> type, Object key) {
        ensureActive();
        try {
            return Optional.ofNullable(entityManager.find(type, key));
        } catch (RuntimeException e) {
            throw JpaExceptionTranslator.translate(e);
        }
    }

    @Override
    public <T> List<T> findAll(Class<T> type) {
        ensureActive();
        try {
            CriteriaQuery<T> query = entityManager.getCriteriaBuilder().createQuery(type);
            query.select(query.from(type));
            return entityManager.createQuery(query).getResultList();
        } catch (RuntimeException e) {
            throw JpaExceptionTranslator.translate(e);
        }
    }

    @Override
    public <T> T insert(T entity) {
        ensureWritable();
        try {
            entityManager.persist(entity);
            entityManager.flush();
            return entity;
        } catch (RuntimeException e) {
            throw JpaExceptionTranslator.translate(e);
        }
    }

    @Override
    public <T> T upsert(T entity) {
        ensureWritable();
        try {
            T merged = entityManager.merge(entity);
            entityManager.flush();
            return merged;
        } catch (RuntimeException e) {
            throw JpaExceptionTranslator.translate(e);
        }
    }

    @Override
    public <T> boolean delete(Class<T> type, Object key) {
        ensureWritable();
        try {
            T existing = entityManager.find(type, key);
            if (existing == null) {
                log.debug("Delete skipped, {} [id={}] not found in scope {}", type.getSimpleName(), key, id);
                return false;
            }
            entityManager.remove(existing);
            entityManager.flush();
            return true;
        } catch (RuntimeException e) {
            throw JpaExceptionTranslator.translate(e);
        }
    }

    EntityTransaction getTransaction() {
        return transaction;
    }

    boolean isClosed() {
        return closed;
    }

    void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (entityManager.isOpen()) {
                entityManager.close();
            }
        } catch (RuntimeException e) {
            log.warn("Failed to close EntityManager for scope {}: {}", id, e.getMessage());
        }
    }

    private void ensureActive() {
        if (!isActive()) {
            throw new IllegalStateException("Scope " + id + " is no longer active");
        }
    }

    private void ensureWritable() {
        ensureActive();
        if (readOnly) {
            throw new IllegalStateException("Scope " + id + " is read-only");
        }
    }
}
