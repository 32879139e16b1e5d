package com.jsonvaluate.exception;

/**
 * Exception thrown when a custom operator is registered incorrectly:
 * missing identifier, missing validator, or a reserved built-in identifier.
 * This signals a programming error at the call site and is not meant to be caught.
 */
public class InvalidOperatorException extends ConditionEngineException {

    public InvalidOperatorException(String message) {
        super(message);
    }
}
