package io.scoreline.tx.core.store;

import java.sql.Connection;
import java.util.Locale;

/**
 * Storage isolation levels, named after their SQL counterparts.
 */
public enum IsolationLevel {

    READ_UNCOMMITTED(Connection.TRANSACTION_READ_UNCOMMITTED, "READ UNCOMMITTED"),
    READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED, "READ COMMITTED"),
    REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ, "REPEATABLE READ"),
    SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE, "SERIALIZABLE");

    private final int jdbcLevel;
    private final String sqlName;

    IsolationLevel(int jdbcLevel, String sqlName) {
        this.jdbcLevel = jdbcLevel;
        this.sqlName = sqlName;
    }

    public int getJdbcLevel() {
        return jdbcLevel;
    }

    public String getSqlName() {
        return sqlName;
    }

    /**
     * Accepts both {@code READ_COMMITTED} and {@code "read committed"} forms.
     */
    public static IsolationLevel fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Isolation level name must not be empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', ' ').replace('_', ' ');
        for (IsolationLevel level : values()) {
            if (level.sqlName.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown isolation level: " + name);
    }
}
