package com.jsonvaluate.config;

import com.jsonvaluate.core.ConditionEngine;
import com.jsonvaluate.exception.ConfigurationException;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Evaluates the rules of a rule set against data records.
 */
public class RuleBook {

    private final RuleSetConfig ruleSet;
    private final ConditionEngine engine;

    public RuleBook(RuleSetConfig ruleSet, ConditionEngine engine) {
        this.ruleSet = ruleSet;
        this.engine = engine;
    }

    /**
     * Evaluate a single rule.
     *
     * @param ruleName name of the rule
     * @param data     data record
     * @return true if the rule's condition matches
     * @throws ConfigurationException if no rule has this name
     */
    public boolean matches(String ruleName, Map<String, Object> data) {
        RuleConfig rule = ruleSet.getRule(ruleName)
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown rule '" + ruleName + "' in rule set '" + ruleSet.name() + "'"));
        return engine.evaluateEither(rule.condition(), data);
    }

    /**
     * Names of all rules matching the data record, in declaration order.
     */
    public List<String> matchingRules(Map<String, Object> data) {
        return ruleSet.rules().stream()
                .filter(rule -> engine.evaluateEither(rule.condition(), data))
                .map(RuleConfig::name)
                .collect(Collectors.toList());
    }

    public List<String> ruleNames() {
        return ruleSet.rules().stream()
                .map(RuleConfig::name)
                .collect(Collectors.toList());
    }

    public RuleSetConfig getRuleSet() {
        return ruleSet;
    }
}
