package io.scoreline.tx.oracle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Signed oracle submission: a timestamp (unix seconds or milliseconds), the
 * feed prices, the signature over both, and optionally the claimed signer.
 */
public final class UpdateSnapshotRequest {

    private final long timestamp;
    private final List<FeedPrice> feeds;
    private final String signature;
    private final String signer;

    @JsonCreator
    public UpdateSnapshotRequest(@JsonProperty("timestamp") long timestamp,
                                 @JsonProperty("feeds") List<FeedPrice> feeds,
                                 @JsonProperty("signature") String signature,
                                 @JsonProperty("signer") String signer) {
        this.timestamp = timestamp;
        this.feeds = feeds == null ? null : List.copyOf(feeds);
        this.signature = signature;
        this.signer = signer;
    }

    public UpdateSnapshotRequest(long timestamp, List<FeedPrice> feeds, String signature) {
        this(timestamp, feeds, signature, null);
    }

    public long getTimestamp() { return timestamp; }
    public List<FeedPrice> getFeeds() { return feeds; }
    public String getSignature() { return signature; }
    public String getSigner() { return signer; }

    public boolean hasSigner() {
        return signer != null && !signer.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "UpdateSnapshotRequest{timestamp=" + timestamp
            + ", feeds=" + (feeds == null ? 0 : feeds.size())
            + ", signer=" + signer + "}";
    }
}
