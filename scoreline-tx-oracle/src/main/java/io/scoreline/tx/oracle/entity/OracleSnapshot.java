package io.scoreline.tx.oracle.entity;

import io.scoreline.tx.core.store.Identifiable;
import io.scoreline.tx.oracle.model.FeedPrice;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable record of one accepted oracle submission.
 */
@Entity
@Table(name = "oracle_snapshots")
public class OracleSnapshot implements Identifiable {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(nullable = false, length = 128)
    private String signer;

    @Column(nullable = false, length = 256)
    private String signature;

    @Convert(converter = FeedPriceListConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<FeedPrice> feeds = new ArrayList<>();

    @Column(nullable = false)
    private Instant createdAt;

    protected OracleSnapshot() {
    }

    public OracleSnapshot(String id, Instant timestamp, String signer, String signature,
                          List<FeedPrice> feeds, Instant createdAt) {
        this.id = id;
        this.timestamp = timestamp;
        this.signer = signer;
        this.signature = signature;
        this.feeds = new ArrayList<>(feeds);
        this.createdAt = createdAt;
    }

    @Override
    public String getId() { return id; }
    public Instant getTimestamp() { return timestamp; }
    public String getSigner() { return signer; }
    public String getSignature() { return signature; }
    public List<FeedPrice> getFeeds() { return feeds; }
    public Instant getCreatedAt() { return createdAt; }

    @Override
    public String toString() {
        return "OracleSnapshot{id=" + id + ", timestamp=" + timestamp + ", feeds=" + feeds.size() + "}";
    }
}
