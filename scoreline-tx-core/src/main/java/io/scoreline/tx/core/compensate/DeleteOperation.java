package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.store.StorageScope;

import java.util.function.UnaryOperator;

/**
 * Deletes a row if present. Compensation writes the captured row back.
 * The result is the deleted row, or null if there was nothing to delete.
 */
public class DeleteOperation<E> extends CompensatableOperation<E> {

    private final Class<E> type;
    private final Object id;
    private final UnaryOperator<E> snapshot;

    public DeleteOperation(String label, Class<E> type, Object id, UnaryOperator<E> snapshot) {
        super(label);
        this.type = type;
        this.id = id;
        this.snapshot = snapshot == null ? UnaryOperator.identity() : snapshot;
    }

    public DeleteOperation(String label, Class<E> type, Object id) {
        this(label, type, id, null);
    }

    @Override
    protected E doExecute(StorageScope scope) {
        E existing = scope.find(type, id).map(snapshot).orElse(null);
        if (existing == null) {
            return null;
        }
        scope.delete(type, id);
        return existing;
    }

    @Override
    protected void doCompensate(StorageScope scope, E deleted) {
        if (deleted != null) {
            scope.upsert(deleted);
        }
    }
}
