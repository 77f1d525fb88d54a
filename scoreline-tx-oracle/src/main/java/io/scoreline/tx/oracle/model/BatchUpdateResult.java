package io.scoreline.tx.oracle.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Outcome of a batch submission. Each request was applied or rejected on its
 * own; {@code results} keeps submission order of the successful ones.
 */
public final class BatchUpdateResult {

    private final List<UpdateSnapshotResult> results;
    private final List<BatchItemFailure> failures;

    public BatchUpdateResult(List<UpdateSnapshotResult> results, List<BatchItemFailure> failures) {
        this.results = List.copyOf(results);
        this.failures = List.copyOf(failures);
    }

    public List<UpdateSnapshotResult> getResults() { return results; }
    public List<BatchItemFailure> getFailures() { return failures; }

    public int getSubmitted() {
        return results.size() + failures.size();
    }

    @JsonIgnore
    public boolean isComplete() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchUpdateResult{succeeded=" + results.size() + ", failed=" + failures.size() + "}";
    }
}
