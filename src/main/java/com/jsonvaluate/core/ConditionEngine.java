package com.jsonvaluate.core;

import com.jsonvaluate.condition.Condition;
import com.jsonvaluate.condition.ConditionConverter;
import com.jsonvaluate.condition.ConditionEvaluator;
import com.jsonvaluate.condition.ConditionGroup;
import com.jsonvaluate.condition.ConditionNode;
import com.jsonvaluate.condition.DefaultConditionEvaluator;
import com.jsonvaluate.operator.OperatorRegistry;
import com.jsonvaluate.operator.OperatorValidator;

import java.util.Map;
import java.util.Set;

/**
 * Entry point of the condition engine: evaluation of both condition representations,
 * custom operator management, and tree-to-chain conversion.
 * <p>
 * Instances are thread-safe. Engines sharing an {@link OperatorRegistry} see the same
 * custom operators.
 *
 * <pre>
 * ConditionEngine engine = ConditionEngine.create();
 * engine.registerOperator("iequal", (field, expected) -&gt;
 *         ValueCoercion.toString(field).equalsIgnoreCase(ValueCoercion.toString(expected)));
 *
 * boolean adult = engine.evaluate(ConditionNode.leaf("age", "gt", 18), Map.of("age", 25));
 * </pre>
 */
public class ConditionEngine {

    private final OperatorRegistry registry;
    private final ConditionEvaluator evaluator;

    public ConditionEngine(OperatorRegistry registry) {
        this(registry, new DefaultConditionEvaluator(registry));
    }

    public ConditionEngine(OperatorRegistry registry, ConditionEvaluator evaluator) {
        this.registry = registry;
        this.evaluator = evaluator;
    }

    /**
     * Create an engine with its own, empty operator registry.
     */
    public static ConditionEngine create() {
        return new ConditionEngine(new OperatorRegistry());
    }

    public boolean evaluate(ConditionNode node, Map<String, Object> data) {
        return evaluator.evaluate(node, data);
    }

    public boolean evaluateChain(ConditionGroup group, Map<String, Object> data) {
        return evaluator.evaluateChain(group, data);
    }

    public boolean evaluateEither(Condition condition, Map<String, Object> data) {
        return evaluator.evaluateEither(condition, data);
    }

    public void registerOperator(String id, OperatorValidator validator) {
        registry.register(id, validator);
    }

    public void unregisterOperator(String id) {
        registry.unregister(id);
    }

    public Set<String> listOperators() {
        return registry.list();
    }

    public ConditionGroup convertTreeToChain(ConditionNode node) {
        return ConditionConverter.toChain(node);
    }

    public OperatorRegistry getRegistry() {
        return registry;
    }

    public ConditionEvaluator getEvaluator() {
        return evaluator;
    }
}
