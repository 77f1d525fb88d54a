package io.scoreline.tx.core.monitor;

/**
 * Lifecycle callbacks invoked synchronously by the transaction manager, on the
 * thread that called {@code execute}. Implementations must not throw; the
 * manager logs and ignores anything they do throw.
 */
public interface TransactionHooks {

    default void onBegin(TransactionEvent event) {
    }

    default void onCommit(TransactionEvent event) {
    }

    default void onRollback(TransactionEvent event) {
    }

    default void onCompensate(TransactionEvent event) {
    }

    default void onRetry(TransactionEvent event) {
    }

    default void onTimeout(TransactionEvent event) {
    }

    /**
     * Routes an event to the callback matching its type.
     */
    default void dispatch(TransactionEvent event) {
        switch (event.getType()) {
            case BEGIN:
                onBegin(event);
                break;
            case COMMIT:
                onCommit(event);
                break;
            case ROLLBACK:
                onRollback(event);
                break;
            case COMPENSATE:
                onCompensate(event);
                break;
            case RETRY:
                onRetry(event);
                break;
            case TIMEOUT:
                onTimeout(event);
                break;
            default:
                throw new IllegalArgumentException("Unknown event type " + event.getType());
        }
    }
}
