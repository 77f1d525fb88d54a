package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.store.StorageScope;

import java.util.function.UnaryOperator;

/**
 * Creates or replaces a row. The previous row, if any, is captured inside the
 * attempt before the write; compensation restores it, or deletes the row when
 * there was none before.
 *
 * <p>The snapshot function must return a detached copy when the store hands
 * out managed instances (JPA), otherwise the write would alter the captured
 * state as well.
 */
public class UpsertOperation<E> extends CompensatableOperation<E> {

    private final Class<E> type;
    private final Object id;
    private final E entity;
    private final UnaryOperator<E> snapshot;
    private volatile E previous;

    public UpsertOperation(String label, Class<E> type, Object id, E entity, UnaryOperator<E> snapshot) {
        super(label);
        this.type = type;
        this.id = id;
        this.entity = entity;
        this.snapshot = snapshot == null ? UnaryOperator.identity() : snapshot;
    }

    public UpsertOperation(String label, Class<E> type, Object id, E entity) {
        this(label, type, id, entity, null);
    }

    @Override
    protected E doExecute(StorageScope scope) {
        previous = scope.find(type, id).map(snapshot).orElse(null);
        return scope.upsert(entity);
    }

    @Override
    protected void doCompensate(StorageScope scope, E result) {
        if (previous != null) {
            scope.upsert(previous);
        } else {
            scope.delete(type, id);
        }
    }

    /**
     * Row that existed before the write, or null if it was created.
     */
    public E getPrevious() {
        return previous;
    }
}
