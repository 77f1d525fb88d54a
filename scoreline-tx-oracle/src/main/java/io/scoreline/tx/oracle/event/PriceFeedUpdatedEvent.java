package io.scoreline.tx.oracle.event;

import io.scoreline.tx.core.event.DomainEvent;

import java.time.Instant;

/**
 * Published per pair after a snapshot committed. {@code previousPrice} is null
 * when the pair was seen for the first time.
 */
public class PriceFeedUpdatedEvent extends DomainEvent {

    public static final String EVENT_TYPE = "PriceFeedUpdated";

    private final String pair;
    private final String price;
    private final int decimals;
    private final String previousPrice;
    private final Instant timestamp;
    private final String snapshotId;

    public PriceFeedUpdatedEvent(String pair, String price, int decimals, String previousPrice,
                                 Instant timestamp, String snapshotId) {
        this.pair = pair;
        this.price = price;
        this.decimals = decimals;
        this.previousPrice = previousPrice;
        this.timestamp = timestamp;
        this.snapshotId = snapshotId;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public String getAggregateType() {
        return "OracleLatestPrice";
    }

    public String getPair() { return pair; }
    public String getPrice() { return price; }
    public int getDecimals() { return decimals; }
    public String getPreviousPrice() { return previousPrice; }
    public Instant getTimestamp() { return timestamp; }
    public String getSnapshotId() { return snapshotId; }
}
