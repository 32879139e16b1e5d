package com.jsonvaluate.condition;

/**
 * Common supertype of the two condition representations:
 * the nested tree ({@link ConditionNode}) and the flat chain ({@link ConditionGroup}).
 */
public interface Condition {
}
