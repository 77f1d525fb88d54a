package io.scoreline.tx.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store with per-scope write buffers. Reads see committed rows plus
 * the scope's own writes (read committed); stricter isolation levels are
 * accepted but not enforced. Entities are stored by reference and must not be
 * mutated after being written.
 */
public class InMemoryTransactionalStore implements TransactionalStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransactionalStore.class);

    private static final Object TOMBSTONE = new Object();

    private final Map<Class<?>, Map<Object, Object>> committed = new HashMap<>();
    private final Object commitLock = new Object();
    private final AtomicLong scopeSequence = new AtomicLong(0);

    @Override
    public StorageScope beginTransaction(IsolationLevel isolationLevel, boolean readOnly) {
        String id = "mem-" + scopeSequence.incrementAndGet();
        log.trace("Opened in-memory scope {} ({}, readOnly={})", id, isolationLevel, readOnly);
        return new InMemoryScope(id, isolationLevel, readOnly);
    }

    @Override
    public void commit(StorageScope scope) {
        InMemoryScope memScope = ownScope(scope);
        if (!memScope.active) {
            throw new IllegalStateException("Scope " + scope.getId() + " is no longer active");
        }

        synchronized (commitLock) {
            for (Map.Entry<Class<?>, Map<Object, Object>> typeWrites : memScope.writes.entrySet()) {
                Map<Object, Object> rows = committed.computeIfAbsent(typeWrites.getKey(), k -> new LinkedHashMap<>());
                for (Map.Entry<Object, Object> write : typeWrites.getValue().entrySet()) {
                    if (write.getValue() == TOMBSTONE) {
                        rows.remove(write.getKey());
                    } else {
                        rows.put(write.getKey(), write.getValue());
                    }
                }
            }
        }

        memScope.active = false;
        log.trace("Committed in-memory scope {}", scope.getId());
    }

    @Override
    public void rollback(StorageScope scope) {
        InMemoryScope memScope = ownScope(scope);
        if (!memScope.active) {
            log.trace("Rollback ignored for inactive scope {}", scope.getId());
            return;
        }
        memScope.writes.clear();
        memScope.active = false;
        log.trace("Rolled back in-memory scope {}", scope.getId());
    }

    /**
     * Committed row count for a type, outside of any transaction.
     */
    public int count(Class<?> type) {
        synchronized (commitLock) {
            Map<Object, Object> rows = committed.get(type);
            return rows == null ? 0 : rows.size();
        }
    }

    /**
     * Committed rows of a type, outside of any transaction.
     */
    public <T> List<T> committedRows(Class<T> type) {
        synchronized (commitLock) {
            Map<Object, Object> rows = committed.get(type);
            List<T> result = new ArrayList<>();
            if (rows != null) {
                for (Object row : rows.values()) {
                    result.add(type.cast(row));
                }
            }
            return result;
        }
    }

    public void clear() {
        synchronized (commitLock) {
            committed.clear();
        }
    }

    private InMemoryScope ownScope(StorageScope scope) {
        if (!(scope instanceof InMemoryScope) || ((InMemoryScope) scope).store() != this) {
            throw new IllegalArgumentException("Scope " + (scope == null ? null : scope.getId())
                + " was not opened by this store");
        }
        return (InMemoryScope) scope;
    }

    private static Object keyOf(Object entity) {
        if (!(entity instanceof Identifiable)) {
            throw new IllegalArgumentException(
                "In-memory store requires Identifiable entities: " + entity.getClass().getName());
        }
        Object id = ((Identifiable) entity).getId();
        if (id == null) {
            throw new IllegalArgumentException("Entity id must be assigned before it is stored: "
                + entity.getClass().getSimpleName());
        }
        return id;
    }

    private final class InMemoryScope implements StorageScope {

        private final String id;
        private final IsolationLevel isolationLevel;
        private final boolean readOnly;
        private final Map<Class<?>, Map<Object, Object>> writes = new LinkedHashMap<>();
        private volatile boolean active = true;

        InMemoryScope(String id, IsolationLevel isolationLevel, boolean readOnly) {
            this.id = id;
            this.isolationLevel = isolationLevel;
            this.readOnly = readOnly;
        }

        InMemoryTransactionalStore store() {
            return InMemoryTransactionalStore.this;
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
            return active;
        }

        @Override
        public <T> Optional<T> find(Class<T> type, Object key) {
            ensureActive();
            Map<Object, Object> own = writes.get(type);
            if (own != null && own.containsKey(key)) {
                Object value = own.get(key);
                return value == TOMBSTONE ? Optional.empty() : Optional.of(type.cast(value));
            }
            synchronized (commitLock) {
                Map<Object, Object> rows = committed.get(type);
                return rows == null ? Optional.empty() : Optional.ofNullable(type.cast(rows.get(key)));
            }
        }

        @Override
        public <T> List<T> findAll(Class<T> type) {
            ensureActive();
            Map<Object, Object> merged;
            synchronized (commitLock) {
                Map<Object, Object> rows = committed.get(type);
                merged = rows == null ? new LinkedHashMap<>() : new LinkedHashMap<>(rows);
            }
            Map<Object, Object> own = writes.get(type);
            if (own != null) {
                for (Map.Entry<Object, Object> write : own.entrySet()) {
                    if (write.getValue() == TOMBSTONE) {
                        merged.remove(write.getKey());
                    } else {
                        merged.put(write.getKey(), write.getValue());
                    }
                }
            }
            List<T> result = new ArrayList<>(merged.size());
            for (Object row : merged.values()) {
                result.add(type.cast(row));
            }
            return result;
        }

        @Override
        public <T> T insert(T entity) {
            ensureWritable();
            Object key = keyOf(entity);
            if (find(entity.getClass(), key).isPresent()) {
                throw new IllegalStateException("Duplicate key " + key + " for "
                    + entity.getClass().getSimpleName());
            }
            writes.computeIfAbsent(entity.getClass(), k -> new LinkedHashMap<>()).put(key, entity);
            return entity;
        }

        @Override
        public <T> T upsert(T entity) {
            ensureWritable();
            Object key = keyOf(entity);
            writes.computeIfAbsent(entity.getClass(), k -> new LinkedHashMap<>()).put(key, entity);
            return entity;
        }

        @Override
        public <T> boolean delete(Class<T> type, Object key) {
            ensureWritable();
            if (find(type, key).isEmpty()) {
                return false;
            }
            writes.computeIfAbsent(type, k -> new LinkedHashMap<>()).put(key, TOMBSTONE);
            return true;
        }

        private void ensureActive() {
            if (!active) {
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
}
