package com.jsonvaluate.condition;

import com.jsonvaluate.operator.OperatorRegistry;
import com.jsonvaluate.operator.OperatorValidator;
import com.jsonvaluate.value.ValueCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Evaluates a single {@code (key, operator, value)} comparison against a data record.
 * <p>
 * Built-in operators are dispatched directly; any other identifier is looked up in the
 * {@link OperatorRegistry}. Unknown operators, missing keys and operands of the wrong
 * shape all yield false.
 */
public class LeafEvaluator {

    private static final Logger log = LoggerFactory.getLogger(LeafEvaluator.class);

    private final OperatorRegistry registry;

    public LeafEvaluator(OperatorRegistry registry) {
        this.registry = registry;
    }

    /**
     * Evaluate one comparison.
     *
     * @param key      data record key
     * @param operator built-in or custom operator identifier
     * @param expected comparison operand
     * @param data     data record, may be null
     * @return true if the comparison holds
     */
    public boolean evaluate(String key, String operator, Object expected, Map<String, Object> data) {
        boolean exists = key != null && data != null && data.containsKey(key);
        Object actual = exists ? data.get(key) : null;

        Optional<Operator> builtin = Operator.fromId(operator);
        if (builtin.isPresent() && !builtin.get().requiresKey()) {
            return evaluateState(builtin.get(), actual, exists);
        }

        if (builtin.isEmpty()) {
            // Custom operators also run for absent keys, with a null field value
            return evaluateCustom(operator, actual, expected);
        }
        if (!exists) {
            return false;
        }
        return evaluateBuiltin(builtin.get(), actual, expected);
    }

    private boolean evaluateState(Operator operator, Object actual, boolean exists) {
        return switch (operator) {
            case IS_NULL -> !exists || actual == null;
            case IS_NOT_NULL -> exists && actual != null;
            case IS_EMPTY -> ValueCoercion.isEmpty(actual);
            case IS_NOT_EMPTY -> !ValueCoercion.isEmpty(actual);
            case IS_TRUE -> ValueCoercion.toBool(actual);
            case IS_FALSE -> !ValueCoercion.toBool(actual);
            default -> throw new IllegalStateException("Not a state operator: " + operator);
        };
    }

    private boolean evaluateBuiltin(Operator operator, Object actual, Object expected) {
        return switch (operator) {
            case EQ -> ValueCoercion.isEqual(actual, expected);
            case NEQ -> !ValueCoercion.isEqual(actual, expected);
            case GT -> ValueCoercion.compareValues(actual, expected) > 0;
            case GTE -> ValueCoercion.compareValues(actual, expected) >= 0;
            case LT -> ValueCoercion.compareValues(actual, expected) < 0;
            case LTE -> ValueCoercion.compareValues(actual, expected) <= 0;
            case BETWEEN -> BuiltinOperators.between(actual, expected);
            case NOT_BETWEEN -> !BuiltinOperators.between(actual, expected);
            case IN -> BuiltinOperators.isIn(actual, expected);
            case NIN -> !BuiltinOperators.isIn(actual, expected);
            case CONTAINS -> BuiltinOperators.contains(actual, expected);
            case NCONTAINS -> !BuiltinOperators.contains(actual, expected);
            case LIKE -> BuiltinOperators.like(actual, expected, false);
            case ILIKE -> BuiltinOperators.like(actual, expected, true);
            case NLIKE -> !BuiltinOperators.like(actual, expected, false);
            case STARTS_WITH -> BuiltinOperators.startsWith(actual, expected);
            case ENDS_WITH -> BuiltinOperators.endsWith(actual, expected);
            case IS_NULL, IS_NOT_NULL, IS_EMPTY, IS_NOT_EMPTY, IS_TRUE, IS_FALSE ->
                    throw new IllegalStateException("State operator dispatched as comparison: " + operator);
        };
    }

    private boolean evaluateCustom(String operator, Object actual, Object expected) {
        Optional<OperatorValidator> validator = registry.lookup(operator);
        if (validator.isEmpty()) {
            return false;
        }

        // Registry lock is already released here
        try {
            return validator.get().validate(actual, expected);
        } catch (Exception e) {
            log.warn("Custom operator '{}' failed, treating condition as false: {}", operator, e.toString());
            return false;
        }
    }
}
