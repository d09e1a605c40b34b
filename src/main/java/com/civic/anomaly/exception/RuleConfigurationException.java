package com.civic.anomaly.exception;

/**
 * A detection rule is invalid or conflicts with an existing rule.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
