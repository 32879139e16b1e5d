package com.jsonvaluate.operator;

/**
 * A custom operator definition: identifier plus validator.
 * Declared as beans, these are registered automatically by the Spring integration.
 *
 * @param id        Operator identifier used in conditions (e.g., "iequal")
 * @param validator Validation function
 */
public record CustomOperator(String id, OperatorValidator validator) {

    public static CustomOperator of(String id, OperatorValidator validator) {
        return new CustomOperator(id, validator);
    }
}
