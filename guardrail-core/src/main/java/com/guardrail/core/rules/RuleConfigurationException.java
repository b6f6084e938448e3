package com.guardrail.core.rules;

/**
 * A rule set that cannot be loaded: bad pattern, missing field or duplicate id.
 * Raised at load time only, never per scan.
 */
public class RuleConfigurationException extends RuntimeException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
