package io.scoreline.tx.core.exception;

/**
 * Storage failure expected to succeed on retry without caller intervention:
 * lock contention, lock timeouts, dropped connections.
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
