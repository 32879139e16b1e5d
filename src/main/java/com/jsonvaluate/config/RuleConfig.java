package com.jsonvaluate.config;

import com.jsonvaluate.condition.Condition;

/**
 * A named condition.
 *
 * @param name        Rule name, unique within its rule set
 * @param description Free-text description (optional)
 * @param condition   Condition tree or chain
 */
public record RuleConfig(
        String name,
        String description,
        Condition condition
) {
}
