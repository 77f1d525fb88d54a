package io.scoreline.tx.core.transaction;

import io.scoreline.tx.core.context.TransactionContext;

/**
 * The caller's unit of work. Invoked once per attempt with a fresh context.
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(TransactionContext context) throws Exception;
}
