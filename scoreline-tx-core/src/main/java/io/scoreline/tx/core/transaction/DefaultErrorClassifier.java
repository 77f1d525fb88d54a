package io.scoreline.tx.core.transaction;

import io.scoreline.tx.core.exception.BusinessRuleException;
import io.scoreline.tx.core.exception.TransactionTimeoutException;
import io.scoreline.tx.core.exception.TransientStorageException;
import io.scoreline.tx.core.exception.ValidationException;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import jakarta.persistence.QueryTimeoutException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Treats storage contention, connection loss and timeouts as transient.
 * Walks the cause chain; validation and business rule failures found first
 * stop the walk and are never retried.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    @Override
    public boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof ValidationException || current instanceof BusinessRuleException) {
                return false;
            }
            if (isTransientType(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    protected boolean isTransientType(Throwable error) {
        if (error instanceof TransientStorageException
                || error instanceof TransactionTimeoutException
                || error instanceof LockTimeoutException
                || error instanceof PessimisticLockException
                || error instanceof QueryTimeoutException
                || error instanceof OptimisticLockException
                || error instanceof SQLTransientException
                || error instanceof SQLRecoverableException) {
            return true;
        }
        if (error instanceof SQLException) {
            String state = ((SQLException) error).getSQLState();
            return state != null && (state.startsWith("40") || state.startsWith("08"));
        }
        return false;
    }
}
