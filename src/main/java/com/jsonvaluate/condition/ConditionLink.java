package com.jsonvaluate.condition;

/**
 * One link of a condition chain: either a leaf comparison or a nested chain,
 * plus the connective joining its result to the next link.
 *
 * @param key       Data record key for a leaf link
 * @param operator  Operator identifier for a leaf link
 * @param value     Comparison operand for a leaf link
 * @param group     Nested chain, or null for a leaf link
 * @param nextLogic Connective to the following link; null means AND. Ignored on the last link.
 */
public record ConditionLink(
        String key,
        String operator,
        Object value,
        ConditionGroup group,
        Logic nextLogic
) {

    public boolean isGroup() {
        return group != null;
    }

    public static ConditionLink leaf(String key, String operator, Object value) {
        return new ConditionLink(key, operator, value, null, null);
    }

    public static ConditionLink leaf(String key, String operator, Object value, Logic nextLogic) {
        return new ConditionLink(key, operator, value, null, nextLogic);
    }

    public static ConditionLink leaf(String key, Operator operator, Object value, Logic nextLogic) {
        return leaf(key, operator.id(), value, nextLogic);
    }

    public static ConditionLink group(ConditionGroup group, Logic nextLogic) {
        return new ConditionLink(null, null, null, group, nextLogic);
    }

    @Override
    public String toString() {
        String body = isGroup() ? "(" + group + ")" : key + " " + operator + " " + value;
        return nextLogic == null ? body : body + " " + nextLogic;
    }
}
