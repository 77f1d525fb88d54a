package io.scoreline.tx.oracle.event;

import io.scoreline.tx.core.event.DomainEvent;
import io.scoreline.tx.oracle.model.FeedPrice;

import java.time.Instant;
import java.util.List;

/**
 * Published once per committed oracle submission.
 */
public class OracleSnapshotRecordedEvent extends DomainEvent {

    public static final String EVENT_TYPE = "OracleSnapshotRecorded";

    private final String snapshotId;
    private final String signer;
    private final String signature;
    private final List<FeedPrice> feeds;
    private final Instant timestamp;

    public OracleSnapshotRecordedEvent(String snapshotId, String signer, String signature,
                                       List<FeedPrice> feeds, Instant timestamp) {
        this.snapshotId = snapshotId;
        this.signer = signer;
        this.signature = signature;
        this.feeds = List.copyOf(feeds);
        this.timestamp = timestamp;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public String getAggregateType() {
        return "OracleSnapshot";
    }

    public String getSnapshotId() { return snapshotId; }
    public String getSigner() { return signer; }
    public String getSignature() { return signature; }
    public List<FeedPrice> getFeeds() { return feeds; }
    public Instant getTimestamp() { return timestamp; }
}
