package io.scoreline.tx.core.store.jpa;

import io.scoreline.tx.core.exception.TransientStorageException;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import jakarta.persistence.QueryTimeoutException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Maps persistence failures that are worth retrying onto
 * {@link TransientStorageException}. Everything else passes through untouched.
 */
final class JpaExceptionTranslator {

    private JpaExceptionTranslator() {
    }

    static RuntimeException translate(RuntimeException e) {
        if (e instanceof TransientStorageException) {
            return e;
        }
        if (e instanceof LockTimeoutException
                || e instanceof PessimisticLockException
                || e instanceof QueryTimeoutException
                || e instanceof OptimisticLockException) {
            return new TransientStorageException("Storage contention: " + e.getMessage(), e);
        }

        Throwable current = e.getCause();
        while (current != null && current != current.getCause()) {
            if (current instanceof SQLTransientException || current instanceof SQLRecoverableException) {
                return new TransientStorageException("Transient SQL failure: " + current.getMessage(), e);
            }
            if (current instanceof SQLException && isTransientSqlState(((SQLException) current).getSQLState())) {
                return new TransientStorageException("Transient SQL state "
                    + ((SQLException) current).getSQLState() + ": " + current.getMessage(), e);
            }
            current = current.getCause();
        }
        return e;
    }

    /**
     * Class 40 is transaction rollback (deadlock, serialization failure),
     * class 08 is connection exception.
     */
    static boolean isTransientSqlState(String sqlState) {
        return sqlState != null && (sqlState.startsWith("40") || sqlState.startsWith("08"));
    }
}
