package io.scoreline.tx.core.exception;

/**
 * Business invariant violated inside a unit of work. Never retried.
 */
public class BusinessRuleException extends RuntimeException {

    private final String rule;

    public BusinessRuleException(String rule, String message) {
        super(message);
        this.rule = rule;
    }

    public BusinessRuleException(String rule, String message, Throwable cause) {
        super(message, cause);
        this.rule = rule;
    }

    public String getRule() {
        return rule;
    }
}
