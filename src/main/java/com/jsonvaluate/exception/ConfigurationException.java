package com.jsonvaluate.exception;

/**
 * Exception thrown when a condition or rule set definition is malformed.
 * Raised while loading, never while evaluating.
 */
public class ConfigurationException extends ConditionEngineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
