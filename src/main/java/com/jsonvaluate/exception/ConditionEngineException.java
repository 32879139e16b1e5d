package com.jsonvaluate.exception;

/**
 * Base exception for the condition engine.
 */
public class ConditionEngineException extends RuntimeException {

    public ConditionEngineException(String message) {
        super(message);
    }

    public ConditionEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
