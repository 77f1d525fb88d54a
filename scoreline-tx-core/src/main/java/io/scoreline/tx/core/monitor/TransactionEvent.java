package io.scoreline.tx.core.monitor;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Immutable record of one lifecycle transition of a transaction attempt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TransactionEvent {

    private final TransactionEventType type;
    private final String txId;
    private final String label;
    private final int attempt;
    private final long timestampMs;
    private final Long durationMs;
    private final String errorMessage;
    private final String operation;

    private TransactionEvent(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.txId = Objects.requireNonNull(builder.txId, "txId");
        this.label = Objects.requireNonNull(builder.label, "label");
        this.attempt = builder.attempt;
        this.timestampMs = builder.timestampMs;
        this.durationMs = builder.durationMs;
        this.errorMessage = builder.errorMessage;
        this.operation = builder.operation;
    }

    public static Builder builder(TransactionEventType type) {
        return new Builder(type);
    }

    public TransactionEventType getType() { return type; }
    public String getTxId() { return txId; }
    public String getLabel() { return label; }
    public int getAttempt() { return attempt; }
    public long getTimestampMs() { return timestampMs; }
    public Long getDurationMs() { return durationMs; }
    public String getErrorMessage() { return errorMessage; }

    /**
     * Label of the compensated operation, set on compensate events only.
     */
    public String getOperation() { return operation; }

    public boolean isError() {
        return errorMessage != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionEvent)) return false;
        TransactionEvent that = (TransactionEvent) o;
        return attempt == that.attempt
                && timestampMs == that.timestampMs
                && type == that.type
                && txId.equals(that.txId)
                && label.equals(that.label)
                && Objects.equals(durationMs, that.durationMs)
                && Objects.equals(errorMessage, that.errorMessage)
                && Objects.equals(operation, that.operation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, txId, label, attempt, timestampMs, durationMs, errorMessage, operation);
    }

    @Override
    public String toString() {
        return "TransactionEvent{" +
                "type=" + type.getValue() +
                ", txId='" + txId + '\'' +
                ", label='" + label + '\'' +
                ", attempt=" + attempt +
                (durationMs != null ? ", durationMs=" + durationMs : "") +
                (operation != null ? ", operation='" + operation + '\'' : "") +
                (errorMessage != null ? ", error='" + errorMessage + '\'' : "") +
                '}';
    }

    public static class Builder {
        private final TransactionEventType type;
        private String txId;
        private String label;
        private int attempt = 1;
        private long timestampMs = System.currentTimeMillis();
        private Long durationMs;
        private String errorMessage;
        private String operation;

        private Builder(TransactionEventType type) {
            this.type = type;
        }

        public Builder txId(String txId) {
            this.txId = txId;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder timestampMs(long timestampMs) {
            this.timestampMs = timestampMs;
            return this;
        }

        public Builder durationMs(Long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public TransactionEvent build() {
            return new TransactionEvent(this);
        }
    }
}
