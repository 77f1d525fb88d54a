package io.scoreline.tx.oracle.entity;

import io.scoreline.tx.core.store.Identifiable;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Objects;

/**
 * Current price of a pair, keyed by the pair name. Points at the snapshot
 * that last wrote it.
 */
@Entity
@Table(name = "oracle_latest_prices")
public class OracleLatestPrice implements Identifiable {

    @Id
    @Column(length = 64)
    private String pair;

    @Column(nullable = false, length = 78)
    private String price;

    @Column(nullable = false)
    private int decimals;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(name = "snapshot_id", nullable = false, length = 36)
    private String snapshotId;

    protected OracleLatestPrice() {
    }

    public OracleLatestPrice(String pair, String price, int decimals, Instant timestamp, String snapshotId) {
        this.pair = pair;
        this.price = price;
        this.decimals = decimals;
        this.timestamp = timestamp;
        this.snapshotId = snapshotId;
    }

    /**
     * Detached copy, used to capture the prior row before it is overwritten.
     */
    public OracleLatestPrice copy() {
        return new OracleLatestPrice(pair, price, decimals, timestamp, snapshotId);
    }

    @Override
    public String getId() { return pair; }
    public String getPair() { return pair; }
    public String getPrice() { return price; }
    public int getDecimals() { return decimals; }
    public Instant getTimestamp() { return timestamp; }
    public String getSnapshotId() { return snapshotId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OracleLatestPrice)) return false;
        OracleLatestPrice that = (OracleLatestPrice) o;
        return decimals == that.decimals && Objects.equals(pair, that.pair) && Objects.equals(price, that.price)
            && Objects.equals(timestamp, that.timestamp) && Objects.equals(snapshotId, that.snapshotId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pair, price, decimals, timestamp, snapshotId);
    }

    @Override
    public String toString() {
        return "OracleLatestPrice{" + pair + "=" + price + ", snapshot=" + snapshotId + "}";
    }
}
