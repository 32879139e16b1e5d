package com.jsonvaluate.condition;

import java.util.Map;

/**
 * Evaluates condition structures against a data record.
 * Evaluation is pure: neither the condition nor the data record is modified,
 * and no exception escapes for malformed conditions or unexpected data.
 */
public interface ConditionEvaluator {

    /**
     * Evaluate a nested condition tree.
     * Groups short-circuit: AND stops at the first false child, OR at the first true child.
     *
     * @param node condition tree
     * @param data data record
     * @return true if the condition matches
     */
    boolean evaluate(ConditionNode node, Map<String, Object> data);

    /**
     * Evaluate a flat condition chain as a left fold over its links.
     * Every link is evaluated.
     *
     * @param group condition chain
     * @param data  data record
     * @return true if the condition matches
     */
    boolean evaluateChain(ConditionGroup group, Map<String, Object> data);

    /**
     * Evaluate either representation, dispatching on its type.
     *
     * @param condition a {@link ConditionNode} or {@link ConditionGroup}
     * @param data      data record
     * @return the evaluation result, or false if the condition is null or of another type
     */
    default boolean evaluateEither(Condition condition, Map<String, Object> data) {
        if (condition instanceof ConditionNode node) {
            return evaluate(node, data);
        }
        if (condition instanceof ConditionGroup group) {
            return evaluateChain(group, data);
        }
        return false;
    }
}
