package com.jsonvaluate.condition;

import java.util.List;

/**
 * A node of the nested condition tree.
 * <p>
 * A node is a <b>group</b> when {@code logic} is set and {@code children} is non-empty,
 * otherwise a <b>leaf</b> when both {@code key} and {@code operator} are non-empty.
 * Anything else is a degenerate node, which always evaluates to true.
 *
 * @param logic    AND/OR for a group, null for a leaf
 * @param children Child nodes for a group, evaluated in order
 * @param key      Data record key for a leaf
 * @param operator Operator identifier for a leaf (built-in or custom)
 * @param value    Comparison operand for a leaf
 */
public record ConditionNode(
        Logic logic,
        List<ConditionNode> children,
        String key,
        String operator,
        Object value
) implements Condition {

    public ConditionNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean isGroup() {
        return logic != null && !children.isEmpty();
    }

    public boolean isLeaf() {
        return key != null && !key.isEmpty() && operator != null && !operator.isEmpty();
    }

    /**
     * Create a leaf comparison.
     */
    public static ConditionNode leaf(String key, String operator, Object value) {
        return new ConditionNode(null, null, key, operator, value);
    }

    /**
     * Create a leaf comparison with a built-in operator.
     */
    public static ConditionNode leaf(String key, Operator operator, Object value) {
        return leaf(key, operator.id(), value);
    }

    /**
     * Create a group combining children with the given logic.
     */
    public static ConditionNode group(Logic logic, List<ConditionNode> children) {
        return new ConditionNode(logic, children, null, null, null);
    }

    /**
     * Create an AND group: all children must be true.
     */
    public static ConditionNode and(ConditionNode... children) {
        return group(Logic.AND, List.of(children));
    }

    /**
     * Create an OR group: at least one child must be true.
     */
    public static ConditionNode or(ConditionNode... children) {
        return group(Logic.OR, List.of(children));
    }

    /**
     * Create an empty node. It always evaluates to true.
     */
    public static ConditionNode empty() {
        return new ConditionNode(null, null, null, null, null);
    }

    @Override
    public String toString() {
        if (isGroup()) {
            return logic + " " + children;
        }
        if (isLeaf()) {
            return key + " " + operator + " " + value;
        }
        return "ALWAYS_TRUE";
    }
}
