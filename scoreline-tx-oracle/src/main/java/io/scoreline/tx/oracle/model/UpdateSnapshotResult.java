package io.scoreline.tx.oracle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class UpdateSnapshotResult {

    private final String snapshotId;
    private final int feedsUpdated;

    @JsonCreator
    public UpdateSnapshotResult(@JsonProperty("snapshotId") String snapshotId,
                                @JsonProperty("feedsUpdated") int feedsUpdated) {
        this.snapshotId = snapshotId;
        this.feedsUpdated = feedsUpdated;
    }

    public String getSnapshotId() { return snapshotId; }
    public int getFeedsUpdated() { return feedsUpdated; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpdateSnapshotResult)) return false;
        UpdateSnapshotResult that = (UpdateSnapshotResult) o;
        return feedsUpdated == that.feedsUpdated && Objects.equals(snapshotId, that.snapshotId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshotId, feedsUpdated);
    }

    @Override
    public String toString() {
        return "UpdateSnapshotResult{snapshotId=" + snapshotId + ", feedsUpdated=" + feedsUpdated + "}";
    }
}
