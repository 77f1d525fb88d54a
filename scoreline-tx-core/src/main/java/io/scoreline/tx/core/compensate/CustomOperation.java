package io.scoreline.tx.core.compensate;

import io.scoreline.tx.core.store.StorageScope;

/**
 * Operation assembled from a forward function and a compensation lambda.
 */
public class CustomOperation<T> extends CompensatableOperation<T> {

    private final StorageFunction<T> forward;
    private final Compensation<T> compensation;

    public CustomOperation(String label, StorageFunction<T> forward, Compensation<T> compensation) {
        super(label);
        if (forward == null || compensation == null) {
            throw new IllegalArgumentException("Forward action and compensation must not be null");
        }
        this.forward = forward;
        this.compensation = compensation;
    }

    @Override
    protected T doExecute(StorageScope scope) {
        return forward.apply(scope);
    }

    @Override
    protected void doCompensate(StorageScope scope, T result) {
        compensation.compensate(scope, result);
    }
}
