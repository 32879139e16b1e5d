package com.jsonvaluate.operator;

/**
 * Validation function behind a custom operator.
 * <p>
 * Implementations receive the raw field value from the data record ({@code null} when the
 * key is absent) and the raw operand from the condition. Use
 * {@link com.jsonvaluate.value.ValueCoercion} to normalize them.
 */
@FunctionalInterface
public interface OperatorValidator {

    /**
     * @param fieldValue    value found under the condition key, or null
     * @param expectedValue operand declared on the condition
     * @return true if the condition is satisfied
     */
    boolean validate(Object fieldValue, Object expectedValue);
}
