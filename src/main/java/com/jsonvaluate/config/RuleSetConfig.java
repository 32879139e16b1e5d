package com.jsonvaluate.config;

import java.util.List;
import java.util.Optional;

/**
 * Root configuration of a rule set file.
 *
 * @param name    Rule set name
 * @param version Configuration version
 * @param rules   Rules in declaration order
 */
public record RuleSetConfig(
        String name,
        String version,
        List<RuleConfig> rules
) {
    public RuleSetConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Get a rule by name.
     */
    public Optional<RuleConfig> getRule(String ruleName) {
        return rules.stream()
                .filter(r -> r.name().equals(ruleName))
                .findFirst();
    }
}
