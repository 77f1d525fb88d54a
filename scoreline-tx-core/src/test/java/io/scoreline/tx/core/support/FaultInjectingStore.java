package io.scoreline.tx.core.support;

import io.scoreline.tx.core.store.InMemoryTransactionalStore;
import io.scoreline.tx.core.store.IsolationLevel;
import io.scoreline.tx.core.store.StorageScope;
import io.scoreline.tx.core.store.TransactionalStore;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory store that can be told to fail the next begin or commit calls.
 */
public class FaultInjectingStore implements TransactionalStore {

    private final InMemoryTransactionalStore delegate = new InMemoryTransactionalStore();
    private final AtomicInteger beginFailures = new AtomicInteger(0);
    private final AtomicInteger commitFailures = new AtomicInteger(0);
    private final List<StorageScope> rolledBack = new ArrayList<>();
    private final List<StorageScope> committed = new ArrayList<>();
    private volatile Supplier<RuntimeException> failure = () -> new IllegalStateException("injected");

    public FaultInjectingStore failNextBegins(int times, Supplier<RuntimeException> error) {
        this.failure = error;
        beginFailures.set(times);
        return this;
    }

    public FaultInjectingStore failNextCommits(int times, Supplier<RuntimeException> error) {
        this.failure = error;
        commitFailures.set(times);
        return this;
    }

    @Override
    public StorageScope beginTransaction(IsolationLevel isolationLevel, boolean readOnly) {
        if (beginFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw failure.get();
        }
        return delegate.beginTransaction(isolationLevel, readOnly);
    }

    @Override
    public void commit(StorageScope scope) {
        if (commitFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw failure.get();
        }
        delegate.commit(scope);
        synchronized (committed) {
            committed.add(scope);
        }
    }

    @Override
    public void rollback(StorageScope scope) {
        delegate.rollback(scope);
        synchronized (rolledBack) {
            rolledBack.add(scope);
        }
    }

    public InMemoryTransactionalStore getDelegate() {
        return delegate;
    }

    public List<StorageScope> getRolledBack() {
        synchronized (rolledBack) {
            return new ArrayList<>(rolledBack);
        }
    }

    public List<StorageScope> getCommitted() {
        synchronized (committed) {
            return new ArrayList<>(committed);
        }
    }
}
