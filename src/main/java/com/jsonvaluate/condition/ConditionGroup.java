package com.jsonvaluate.condition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A flat condition chain. Links are folded left to right, each pair joined by the
 * {@code nextLogic} of the left link. There is no operator precedence:
 * {@code a OR b AND c} means {@code (a OR b) AND c}.
 *
 * @param conditions Links in evaluation order. An empty chain evaluates to true.
 */
public record ConditionGroup(List<ConditionLink> conditions) implements Condition {

    public ConditionGroup {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static ConditionGroup of(ConditionLink... conditions) {
        return new ConditionGroup(List.of(conditions));
    }

    public static ConditionGroup empty() {
        return new ConditionGroup(List.of());
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    public String toString() {
        return conditions.stream()
                .map(ConditionLink::toString)
                .collect(Collectors.joining(" "));
    }
}
