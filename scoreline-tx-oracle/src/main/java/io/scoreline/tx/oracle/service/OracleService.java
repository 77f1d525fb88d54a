package io.scoreline.tx.oracle.service;

import com.fasterxml.jackson.core.type.TypeReference;
import io.scoreline.tx.core.cache.KeyValueCache;
import io.scoreline.tx.core.compensate.InsertOperation;
import io.scoreline.tx.core.compensate.UpsertOperation;
import io.scoreline.tx.core.context.TransactionContext;
import io.scoreline.tx.core.event.DomainEvent;
import io.scoreline.tx.core.event.EventBus;
import io.scoreline.tx.core.exception.BusinessRuleException;
import io.scoreline.tx.core.exception.TransactionFailedException;
import io.scoreline.tx.core.exception.ValidationException;
import io.scoreline.tx.core.store.StorageScope;
import io.scoreline.tx.core.store.TransactionalStore;
import io.scoreline.tx.core.transaction.TransactionManager;
import io.scoreline.tx.oracle.config.OracleProperties;
import io.scoreline.tx.oracle.entity.OracleLatestPrice;
import io.scoreline.tx.oracle.entity.OracleSnapshot;
import io.scoreline.tx.oracle.event.OracleSnapshotRecordedEvent;
import io.scoreline.tx.oracle.event.PriceFeedUpdatedEvent;
import io.scoreline.tx.oracle.model.BatchItemFailure;
import io.scoreline.tx.oracle.model.BatchUpdateResult;
import io.scoreline.tx.oracle.model.FeedPrice;
import io.scoreline.tx.oracle.model.LatestPrice;
import io.scoreline.tx.oracle.model.UpdateSnapshotRequest;
import io.scoreline.tx.oracle.model.UpdateSnapshotResult;
import io.scoreline.tx.oracle.signature.SignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Applies signed oracle submissions: one snapshot row plus one latest-price
 * upsert per feed, all inside a single compensating transaction.
 *
 * <p>Domain events are published and the latest-price cache is invalidated
 * only after the transaction committed.
 */
public class OracleService {

    private static final Logger log = LoggerFactory.getLogger(OracleService.class);

    public static final String UPDATE_SNAPSHOT_LABEL = "oracle.updateSnapshot";
    public static final String CREATE_SNAPSHOT_OPERATION = "CreateOracleSnapshot";
    public static final String UPDATE_FEED_OPERATION_PREFIX = "UpdatePriceFeed_";

    // values above this are already milliseconds
    private static final long MILLIS_THRESHOLD = 1_000_000_000_000L;

    private static final TypeReference<List<LatestPrice>> LATEST_PRICES = new TypeReference<>() {};

    private final TransactionManager transactionManager;
    private final TransactionalStore store;
    private final SignatureVerifier signatureVerifier;
    private final EventBus eventBus;
    private final KeyValueCache cache;
    private final OracleProperties properties;
    private final Clock clock;

    public OracleService(TransactionManager transactionManager, TransactionalStore store,
                         SignatureVerifier signatureVerifier, EventBus eventBus, KeyValueCache cache,
                         OracleProperties properties, Clock clock) {
        this.transactionManager = transactionManager;
        this.store = store;
        this.signatureVerifier = signatureVerifier;
        this.eventBus = eventBus;
        this.cache = cache;
        this.properties = properties;
        this.clock = clock;
    }

    public OracleService(TransactionManager transactionManager, TransactionalStore store,
                         SignatureVerifier signatureVerifier, EventBus eventBus, KeyValueCache cache,
                         OracleProperties properties) {
        this(transactionManager, store, signatureVerifier, eventBus, cache, properties, Clock.systemUTC());
    }

    /**
     * Validates, verifies and stores one submission.
     *
     * @throws ValidationException           malformed request or timestamp outside the allowed skew
     * @throws BusinessRuleException         bad signature or signer mismatch
     * @throws TransactionFailedException    storage failed after all retries; every applied
     *                                       write of the last attempt was compensated
     */
    public UpdateSnapshotResult updateSnapshot(UpdateSnapshotRequest request) {
        validate(request);
        Instant timestamp = normalizeTimestamp(request.getTimestamp());
        checkClockSkew(timestamp);
        String signer = verifySigner(request);

        SnapshotWrite write = transactionManager.execute(
            context -> applySnapshot(context, request, signer, timestamp),
            properties.toExecutionOptions(UPDATE_SNAPSHOT_LABEL));

        cache.invalidate(properties.getCache().getLatestKey());
        publishEvents(request, signer, timestamp, write);

        log.info("Snapshot {} created with {} price feeds updated",
            write.result.getSnapshotId(), write.result.getFeedsUpdated());
        return write.result;
    }

    /**
     * Applies each request on its own. A failed entry does not undo the entries
     * before it and does not stop the ones after it.
     */
    public BatchUpdateResult batchUpdateSnapshots(List<UpdateSnapshotRequest> requests) {
        if (requests == null) {
            throw new ValidationException("requests must not be null");
        }

        List<UpdateSnapshotResult> results = new ArrayList<>();
        List<BatchItemFailure> failures = new ArrayList<>();

        for (int i = 0; i < requests.size(); i++) {
            try {
                results.add(updateSnapshot(requests.get(i)));
            } catch (RuntimeException e) {
                boolean retryable = e instanceof TransactionFailedException
                    && ((TransactionFailedException) e).isRetryable();
                log.error("Failed to update snapshot {} of {} in batch: {}", i + 1, requests.size(), e.getMessage());
                failures.add(new BatchItemFailure(i, e.getMessage(), retryable));
            }
        }

        if (!failures.isEmpty()) {
            log.warn("Batch finished with partial success: {} applied, {} failed", results.size(), failures.size());
        }
        return new BatchUpdateResult(results, failures);
    }

    /**
     * Latest price of every pair, ordered by pair. Served from the cache while
     * the entry is fresh.
     */
    public List<LatestPrice> getLatest() {
        String key = properties.getCache().getLatestKey();
        List<LatestPrice> cached = cache.get(key, LATEST_PRICES);
        if (cached != null) {
            return cached;
        }

        List<LatestPrice> latest = readLatest();
        long ttlSeconds = properties.getCache().getLatestTtlSeconds();
        if (ttlSeconds > 0) {
            cache.put(key, latest, Duration.ofSeconds(ttlSeconds));
        }
        return latest;
    }

    private SnapshotWrite applySnapshot(TransactionContext context, UpdateSnapshotRequest request,
                                        String signer, Instant timestamp) {
        StorageScope scope = context.getScope();
        String snapshotId = UUID.randomUUID().toString();

        OracleSnapshot snapshot = new OracleSnapshot(snapshotId, timestamp, signer, request.getSignature(),
            request.getFeeds(), clock.instant());
        context.registerOperation(InsertOperation.of(CREATE_SNAPSHOT_OPERATION, snapshot)).execute(scope);

        Map<String, String> previousPrices = new LinkedHashMap<>();
        for (FeedPrice feed : request.getFeeds()) {
            OracleLatestPrice latest = new OracleLatestPrice(feed.getPair(), feed.getPrice(), feed.getDecimals(),
                timestamp, snapshotId);
            UpsertOperation<OracleLatestPrice> operation = new UpsertOperation<>(
                UPDATE_FEED_OPERATION_PREFIX + feed.getPair(), OracleLatestPrice.class, feed.getPair(), latest,
                OracleLatestPrice::copy);

            context.registerOperation(operation).execute(scope);

            OracleLatestPrice previous = operation.getPrevious();
            previousPrices.put(feed.getPair(), previous == null ? null : previous.getPrice());
        }

        return new SnapshotWrite(new UpdateSnapshotResult(snapshotId, request.getFeeds().size()), previousPrices);
    }

    private void publishEvents(UpdateSnapshotRequest request, String signer, Instant timestamp, SnapshotWrite write) {
        String snapshotId = write.result.getSnapshotId();
        List<DomainEvent> events = new ArrayList<>();
        events.add(new OracleSnapshotRecordedEvent(snapshotId, signer, request.getSignature(), request.getFeeds(),
            timestamp));
        for (FeedPrice feed : request.getFeeds()) {
            events.add(new PriceFeedUpdatedEvent(feed.getPair(), feed.getPrice(), feed.getDecimals(),
                write.previousPrices.get(feed.getPair()), timestamp, snapshotId));
        }

        // the snapshot is committed at this point; a publish failure must not report it as failed
        try {
            eventBus.publishBatch(events);
        } catch (RuntimeException e) {
            log.error("Snapshot {} committed but its {} events could not be published", snapshotId, events.size(), e);
        }
    }

    private List<LatestPrice> readLatest() {
        StorageScope scope = store.beginTransaction(properties.getTransaction().getIsolationLevel(), true);
        try {
            return scope.findAll(OracleLatestPrice.class).stream()
                .map(p -> new LatestPrice(p.getPair(), p.getPrice(), p.getDecimals(), p.getTimestamp()))
                .sorted(Comparator.comparing(LatestPrice::getPair))
                .collect(Collectors.toList());
        } finally {
            store.rollback(scope);
        }
    }

    private String verifySigner(UpdateSnapshotRequest request) {
        String configured = properties.hasSignerAddress() ? properties.getSignerAddress().trim() : null;
        String recovered = signatureVerifier.recoverSigner(request, configured);

        if (request.hasSigner() && !recovered.equals(request.getSigner().trim())) {
            throw new BusinessRuleException("signer-mismatch", "Signature was not produced by the claimed signer");
        }
        if (configured != null && !recovered.equals(configured)) {
            throw new BusinessRuleException("signer-mismatch", "Signer is not the configured oracle signer");
        }
        return recovered;
    }

    static Instant normalizeTimestamp(long timestamp) {
        return timestamp > MILLIS_THRESHOLD
            ? Instant.ofEpochMilli(timestamp)
            : Instant.ofEpochSecond(timestamp);
    }

    private void checkClockSkew(Instant timestamp) {
        long maxSkewMs = properties.getMaxClockSkewMs();
        if (maxSkewMs <= 0) {
            return;
        }
        long skewMs = Math.abs(clock.millis() - timestamp.toEpochMilli());
        if (skewMs > maxSkewMs) {
            throw new ValidationException("timestamp out of allowed skew",
                List.of("timestamp is " + skewMs + "ms away from now (max " + maxSkewMs + "ms)"));
        }
    }

    private static void validate(UpdateSnapshotRequest request) {
        if (request == null) {
            throw new ValidationException("request must not be null");
        }

        List<String> violations = new ArrayList<>();
        if (request.getTimestamp() <= 0) {
            violations.add("timestamp must be positive");
        }
        if (request.getSignature() == null || request.getSignature().trim().isEmpty()) {
            violations.add("signature must not be empty");
        }
        if (request.getFeeds() == null || request.getFeeds().isEmpty()) {
            violations.add("feeds must not be empty");
        } else {
            Set<String> pairs = new HashSet<>();
            for (int i = 0; i < request.getFeeds().size(); i++) {
                validateFeed(i, request.getFeeds().get(i), pairs, violations);
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid oracle snapshot request", violations);
        }
    }

    private static void validateFeed(int index, FeedPrice feed, Set<String> pairs, List<String> violations) {
        String prefix = "feeds[" + index + "]";
        if (feed == null) {
            violations.add(prefix + " must not be null");
            return;
        }
        if (feed.getPair() == null || feed.getPair().trim().isEmpty()) {
            violations.add(prefix + ".pair must not be empty");
        } else if (!pairs.add(feed.getPair())) {
            violations.add(prefix + ".pair " + feed.getPair() + " is duplicated");
        }
        if (!isNonNegativeDecimal(feed.getPrice())) {
            violations.add(prefix + ".price must be a non-negative decimal string");
        }
        if (feed.getDecimals() < 0) {
            violations.add(prefix + ".decimals must not be negative");
        }
    }

    private static boolean isNonNegativeDecimal(String price) {
        if (price == null || price.trim().isEmpty()) {
            return false;
        }
        try {
            return new BigDecimal(price).signum() >= 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static final class SnapshotWrite {
        private final UpdateSnapshotResult result;
        private final Map<String, String> previousPrices;

        private SnapshotWrite(UpdateSnapshotResult result, Map<String, String> previousPrices) {
            this.result = result;
            this.previousPrices = previousPrices;
        }
    }
}
