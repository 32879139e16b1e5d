package com.jsonvaluate.condition;

import com.jsonvaluate.operator.OperatorRegistry;

import java.util.List;
import java.util.Map;

/**
 * Default implementation of ConditionEvaluator.
 * Stateless apart from the shared operator registry; safe for concurrent use.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    private final LeafEvaluator leafEvaluator;

    public DefaultConditionEvaluator(OperatorRegistry registry) {
        this(new LeafEvaluator(registry));
    }

    public DefaultConditionEvaluator(LeafEvaluator leafEvaluator) {
        this.leafEvaluator = leafEvaluator;
    }

    @Override
    public boolean evaluate(ConditionNode node, Map<String, Object> data) {
        if (node == null) {
            return true;
        }

        if (node.isGroup()) {
            return switch (node.logic()) {
                case AND -> evaluateAll(node.children(), data);
                case OR -> evaluateAny(node.children(), data);
            };
        }

        if (node.isLeaf()) {
            return leafEvaluator.evaluate(node.key(), node.operator(), node.value(), data);
        }

        // Degenerate node (no valid group, no valid leaf) is the identity: always true
        return true;
    }

    private boolean evaluateAll(List<ConditionNode> children, Map<String, Object> data) {
        for (ConditionNode child : children) {
            if (!evaluate(child, data)) {
                return false;
            }
        }
        return true;
    }

    private boolean evaluateAny(List<ConditionNode> children, Map<String, Object> data) {
        for (ConditionNode child : children) {
            if (evaluate(child, data)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean evaluateChain(ConditionGroup group, Map<String, Object> data) {
        if (group == null || group.isEmpty()) {
            return true;
        }

        List<ConditionLink> links = group.conditions();
        boolean result = evaluateLink(links.get(0), data);
        for (int i = 1; i < links.size(); i++) {
            boolean current = evaluateLink(links.get(i), data);
            Logic connective = links.get(i - 1).nextLogic();
            result = connective == null ? result && current : connective.apply(result, current);
        }
        return result;
    }

    private boolean evaluateLink(ConditionLink link, Map<String, Object> data) {
        if (link.isGroup()) {
            return evaluateChain(link.group(), data);
        }
        return leafEvaluator.evaluate(link.key(), link.operator(), link.value(), data);
    }
}
