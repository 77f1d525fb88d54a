package io.scoreline.tx.core.transaction;

/**
 * Decides whether a failed attempt may be retried.
 */
@FunctionalInterface
public interface ErrorClassifier {

    boolean isTransient(Throwable error);
}
