package io.scoreline.tx.core.transaction;

import io.scoreline.tx.core.compensate.CompensatableOperation;
import io.scoreline.tx.core.context.TransactionContext;
import io.scoreline.tx.core.context.TransactionState;
import io.scoreline.tx.core.exception.TransactionFailedException;
import io.scoreline.tx.core.exception.TransactionTimeoutException;
import io.scoreline.tx.core.monitor.TransactionEvent;
import io.scoreline.tx.core.monitor.TransactionEventType;
import io.scoreline.tx.core.monitor.TransactionHooks;
import io.scoreline.tx.core.store.StorageScope;
import io.scoreline.tx.core.store.TransactionalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a unit of work inside a storage transaction with compensation, retry
 * and a per-attempt deadline.
 *
 * <p>Each attempt opens a new storage scope and a fresh {@link TransactionContext}.
 * When the work (or the commit) fails, every operation that executed in that
 * attempt is compensated in reverse order, the scope is rolled back and the
 * error is classified: transient errors are retried with backoff until
 * {@code maxRetries} is used up, everything else fails immediately.
 *
 * <p>Lifecycle events go to the registered {@link TransactionHooks} from the
 * calling thread, in the order {@code begin -> commit} or
 * {@code begin -> [timeout] -> compensate* -> rollback -> [retry]}.
 */
public class TransactionManager {

    private static final Logger log = LoggerFactory.getLogger(TransactionManager.class);

    public static final long DEFAULT_TIMEOUT_GRACE_MS = 5_000;

    private final TransactionalStore store;
    private final ExecutorService workerExecutor;
    private final boolean ownsExecutor;
    private final ErrorClassifier errorClassifier;
    private final Sleeper sleeper;
    private final Clock clock;
    private final long timeoutGraceMs;

    private final List<TransactionHooks> hooks = new CopyOnWriteArrayList<>();
    private final Map<String, TransactionContext> activeTransactions = new ConcurrentHashMap<>();

    public TransactionManager(TransactionalStore store) {
        this(builder(store));
    }

    private TransactionManager(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.ownsExecutor = builder.workerExecutor == null;
        this.workerExecutor = ownsExecutor ? Executors.newCachedThreadPool(new WorkerThreadFactory()) : builder.workerExecutor;
        this.errorClassifier = builder.errorClassifier;
        this.sleeper = builder.sleeper;
        this.clock = builder.clock;
        this.timeoutGraceMs = builder.timeoutGraceMs;

        log.info("TransactionManager initialized (store={}, timeoutGrace={}ms)",
            store.getClass().getSimpleName(), timeoutGraceMs);
    }

    public static Builder builder(TransactionalStore store) {
        return new Builder(store);
    }

    /**
     * Adds a hook set. Hook sets are invoked in registration order.
     */
    public void registerHooks(TransactionHooks transactionHooks) {
        hooks.add(Objects.requireNonNull(transactionHooks, "hooks"));
    }

    public void unregisterHooks(TransactionHooks transactionHooks) {
        hooks.remove(transactionHooks);
    }

    /**
     * Contexts of the attempts currently in progress.
     */
    public Collection<TransactionContext> getActiveTransactions() {
        return new ArrayList<>(activeTransactions.values());
    }

    public <T> T execute(TransactionWork<T> work, String label) {
        return execute(work, ExecutionOptions.builder().label(label).build());
    }

    /**
     * Runs {@code work} until it commits, retrying transient failures.
     *
     * @return the value returned by the attempt that committed
     * @throws TransactionFailedException once retries are exhausted or the error
     *         is not transient; its cause is the error that failed the last attempt
     */
    public <T> T execute(TransactionWork<T> work, ExecutionOptions options) {
        Objects.requireNonNull(work, "work");
        Objects.requireNonNull(options, "options");

        String txId = UUID.randomUUID().toString();
        String label = options.getLabel();
        int attempt = 1;

        while (true) {
            AttemptOutcome<T> outcome = runAttempt(work, options, txId, attempt);
            if (outcome.error == null) {
                if (attempt > 1) {
                    log.info("Transaction {} [{}] committed on attempt {}", txId, label, attempt);
                }
                return outcome.result;
            }

            Throwable error = outcome.error;
            TransactionContext context = outcome.context;
            boolean retryable = errorClassifier.isTransient(error);

            if (retryable && attempt <= options.getMaxRetries()) {
                long delay = options.backoffDelayMs(attempt);
                log.warn("Transaction {} [{}] attempt {} failed with transient error, retrying in {}ms: {}",
                    txId, label, attempt, delay, describe(error));

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    // no retry event: the transaction ends at the rollback of this attempt
                    Thread.currentThread().interrupt();
                    context.transitionTo(TransactionState.FAILED);
                    log.warn("Transaction {} [{}] interrupted during retry backoff", txId, label);
                    throw new TransactionFailedException(error, txId, label, attempt,
                        context.getLastFailedOperation(), outcome.compensated, outcome.failedCompensations, true);
                }

                context.transitionTo(TransactionState.RETRY_SCHEDULED);
                emit(event(TransactionEventType.RETRY, context)
                    .durationMs(delay)
                    .errorMessage(describe(error))
                    .build());
                attempt++;
                continue;
            }

            context.transitionTo(TransactionState.FAILED);
            if (retryable) {
                log.error("Transaction {} [{}] failed after {} attempt(s), retries exhausted: {}",
                    txId, label, attempt, describe(error));
            } else {
                log.error("Transaction {} [{}] failed with non-retryable error: {}",
                    txId, label, describe(error));
            }
            throw new TransactionFailedException(error, txId, label, attempt,
                context.getLastFailedOperation(), outcome.compensated, outcome.failedCompensations, retryable);
        }
    }

    private <T> AttemptOutcome<T> runAttempt(TransactionWork<T> work, ExecutionOptions options,
                                             String txId, int attempt) {
        long startMs = clock.millis();

        MDC.put("txId", txId);
        MDC.put("txLabel", options.getLabel());
        MDC.put("attempt", String.valueOf(attempt));

        StorageScope scope = null;
        RuntimeException beginError = null;
        try {
            scope = store.beginTransaction(options.getIsolationLevel(), options.isReadOnly());
        } catch (RuntimeException e) {
            beginError = e;
        }

        TransactionContext context = new TransactionContext(txId, options.getLabel(), attempt, scope,
            Instant.ofEpochMilli(startMs));
        activeTransactions.put(txId, context);

        try {
            emit(event(TransactionEventType.BEGIN, context).timestampMs(startMs).build());

            if (beginError != null) {
                log.warn("Failed to open storage transaction for {}: {}", txId, describe(beginError));
                return unwind(context, beginError, startMs);
            }

            context.transitionTo(TransactionState.RUNNING);
            T result;
            try {
                result = runWork(work, context, options);
            } catch (Throwable t) {
                return unwind(context, t, startMs);
            }

            context.transitionTo(TransactionState.COMMITTING);
            try {
                store.commit(scope);
            } catch (RuntimeException e) {
                log.warn("Commit of {} failed: {}", txId, describe(e));
                return unwind(context, e, startMs);
            }

            context.transitionTo(TransactionState.COMMITTED);
            long duration = clock.millis() - startMs;
            log.debug("Transaction {} [{}] committed in {}ms ({} operations)",
                txId, options.getLabel(), duration, context.getExecutedOperations().size());
            emit(event(TransactionEventType.COMMIT, context).durationMs(duration).build());
            return AttemptOutcome.success(context, result);
        } finally {
            activeTransactions.remove(txId, context);
            MDC.remove("txId");
            MDC.remove("txLabel");
            MDC.remove("attempt");
        }
    }

    private <T> T runWork(TransactionWork<T> work, TransactionContext context, ExecutionOptions options)
            throws Exception {
        if (!options.hasTimeout()) {
            return work.execute(context);
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        CountDownLatch finished = new CountDownLatch(1);
        // claimed by whichever side gets there first: the worker to run the work,
        // or the timed out caller to abandon it
        AtomicBoolean claimed = new AtomicBoolean(false);

        Future<T> future = workerExecutor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return null;
            }
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return work.execute(context);
            } finally {
                MDC.clear();
                finished.countDown();
            }
        });

        try {
            return future.get(options.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw (Error) cause;
        } catch (TimeoutException e) {
            boolean workStarted = !claimed.compareAndSet(false, true);
            future.cancel(true);
            context.close();
            long elapsed = clock.millis() - context.getStartTime().toEpochMilli();
            log.warn("Transaction {} [{}] attempt {} timed out after {}ms, cancelling work",
                context.getTxId(), context.getLabel(), context.getAttemptNumber(), options.getTimeoutMs());
            TransactionTimeoutException timeout =
                new TransactionTimeoutException(context.getTxId(), options.getTimeoutMs());
            emit(event(TransactionEventType.TIMEOUT, context)
                .durationMs(elapsed)
                .errorMessage(timeout.getMessage())
                .build());
            if (workStarted) {
                awaitWorker(finished, context);
            }
            throw timeout;
        } catch (InterruptedException e) {
            claimed.compareAndSet(false, true);
            future.cancel(true);
            context.close();
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private void awaitWorker(CountDownLatch finished, TransactionContext context) {
        try {
            if (!finished.await(timeoutGraceMs, TimeUnit.MILLISECONDS)) {
                log.error("Work of transaction {} did not stop within {}ms after timeout; " +
                    "operations it completes from now on will not be compensated", context.getTxId(), timeoutGraceMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for timed out work of {}", context.getTxId());
        }
    }

    private <T> AttemptOutcome<T> unwind(TransactionContext context, Throwable error, long startMs) {
        context.transitionTo(TransactionState.COMPENSATING);
        context.close();

        List<CompensatableOperation<?>> operations = context.getExecutedOperationsInReverseOrder();
        StorageScope scope = context.getScope();
        int compensated = 0;
        int failed = 0;

        if (!operations.isEmpty()) {
            log.warn("═══════════════════════════════════════════════════════════");
            log.warn("Compensating transaction {} [{}] attempt {}", context.getTxId(), context.getLabel(),
                context.getAttemptNumber());
            log.warn("Cause: {}", describe(error));
            log.warn("Operations to compensate: {}", operations.size());
            log.warn("═══════════════════════════════════════════════════════════");
        }

        for (int i = 0; i < operations.size(); i++) {
            CompensatableOperation<?> operation = operations.get(i);
            long opStart = clock.millis();
            try {
                operation.compensate(scope);
                compensated++;
                log.info("✓ Compensated {}/{}: {}", i + 1, operations.size(), operation.getLabel());
                emit(event(TransactionEventType.COMPENSATE, context)
                    .operation(operation.getLabel())
                    .durationMs(clock.millis() - opStart)
                    .build());
            } catch (RuntimeException e) {
                failed++;
                log.error("✗ Compensation {}/{} failed: {}", i + 1, operations.size(), operation.getLabel(), e);
                emit(event(TransactionEventType.COMPENSATE, context)
                    .operation(operation.getLabel())
                    .durationMs(clock.millis() - opStart)
                    .errorMessage(describe(e))
                    .build());
            }
        }

        if (scope != null) {
            try {
                store.rollback(scope);
            } catch (RuntimeException e) {
                log.error("Storage rollback failed for transaction {}", context.getTxId(), e);
            }
        }

        if (failed > 0) {
            log.error("Transaction {} partially compensated: {} succeeded, {} failed - manual review may be needed",
                context.getTxId(), compensated, failed);
        }

        emit(event(TransactionEventType.ROLLBACK, context)
            .durationMs(clock.millis() - startMs)
            .errorMessage(describe(error))
            .build());

        return AttemptOutcome.failure(context, error, compensated, failed);
    }

    private TransactionEvent.Builder event(TransactionEventType type, TransactionContext context) {
        return TransactionEvent.builder(type)
            .txId(context.getTxId())
            .label(context.getLabel())
            .attempt(context.getAttemptNumber())
            .timestampMs(clock.millis());
    }

    private void emit(TransactionEvent event) {
        for (TransactionHooks hook : hooks) {
            try {
                hook.dispatch(event);
            } catch (RuntimeException e) {
                log.warn("Transaction hook {} failed on {} event: {}",
                    hook.getClass().getName(), event.getType().getValue(), e.getMessage(), e);
            }
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    /**
     * Stops the worker pool if this manager created it.
     */
    public void shutdown() {
        if (!ownsExecutor) {
            return;
        }
        log.info("Shutting down TransactionManager worker pool");
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(timeoutGraceMs, TimeUnit.MILLISECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class AttemptOutcome<T> {
        private final TransactionContext context;
        private final T result;
        private final Throwable error;
        private final int compensated;
        private final int failedCompensations;

        private AttemptOutcome(TransactionContext context, T result, Throwable error,
                               int compensated, int failedCompensations) {
            this.context = context;
            this.result = result;
            this.error = error;
            this.compensated = compensated;
            this.failedCompensations = failedCompensations;
        }

        static <T> AttemptOutcome<T> success(TransactionContext context, T result) {
            return new AttemptOutcome<>(context, result, null, 0, 0);
        }

        static <T> AttemptOutcome<T> failure(TransactionContext context, Throwable error,
                                             int compensated, int failedCompensations) {
            return new AttemptOutcome<>(context, null, error, compensated, failedCompensations);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "scoreline-tx-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private final TransactionalStore store;
        private ExecutorService workerExecutor;
        private ErrorClassifier errorClassifier = new DefaultErrorClassifier();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Clock clock = Clock.systemUTC();
        private long timeoutGraceMs = DEFAULT_TIMEOUT_GRACE_MS;

        private Builder(TransactionalStore store) {
            this.store = store;
        }

        /**
         * Executor for units of work that run under a deadline. When unset the
         * manager creates and owns a cached pool of daemon threads.
         */
        public Builder workerExecutor(ExecutorService workerExecutor) {
            this.workerExecutor = workerExecutor;
            return this;
        }

        public Builder errorClassifier(ErrorClassifier errorClassifier) {
            this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * How long to wait for timed out work to stop before compensating.
         */
        public Builder timeoutGraceMs(long timeoutGraceMs) {
            this.timeoutGraceMs = timeoutGraceMs;
            return this;
        }

        public TransactionManager build() {
            return new TransactionManager(this);
        }
    }
}
