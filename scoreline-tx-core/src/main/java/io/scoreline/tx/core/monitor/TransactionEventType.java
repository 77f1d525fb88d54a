package io.scoreline.tx.core.monitor;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransactionEventType {

    BEGIN("begin"),
    COMMIT("commit"),
    ROLLBACK("rollback"),
    COMPENSATE("compensate"),
    RETRY("retry"),
    TIMEOUT("timeout");

    private final String value;

    TransactionEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
