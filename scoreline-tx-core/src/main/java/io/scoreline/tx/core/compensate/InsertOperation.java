package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.store.Identifiable;
import io.scoreline.tx.core.store.StorageScope;

/**
 * Inserts a new row. Compensation deletes it if it is still there.
 */
public class InsertOperation<E> extends CompensatableOperation<E> {

    private final Class<E> type;
    private final Object id;
    private final E entity;

    public InsertOperation(String label, Class<E> type, Object id, E entity) {
        super(label);
        this.type = type;
        this.id = id;
        this.entity = entity;
    }

    @SuppressWarnings("unchecked")
    public static <E extends Identifiable> InsertOperation<E> of(String label, E entity) {
        return new InsertOperation<>(label, (Class<E>) entity.getClass(), entity.getId(), entity);
    }

    @Override
    protected E doExecute(StorageScope scope) {
        return scope.insert(entity);
    }

    @Override
    protected void doCompensate(StorageScope scope, E result) {
        scope.delete(type, id);
    }
}
