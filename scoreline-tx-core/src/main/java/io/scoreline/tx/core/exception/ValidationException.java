package io.scoreline.tx.core.exception;

import java.util.Collections;
import java.util.List;

/**
 * Request rejected before or during a unit of work. Never retried.
 */
public class ValidationException extends RuntimeException {

    private final List<String> violations;

    public ValidationException(String message) {
        super(message);
        this.violations = Collections.emptyList();
    }

    public ValidationException(String message, List<String> violations) {
        super(message + (violations.isEmpty() ? "" : ": " + String.join("; ", violations)));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = Collections.emptyList();
    }

    public List<String> getViolations() {
        return violations;
    }
}
