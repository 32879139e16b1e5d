package com.jsonvaluate.condition;

import com.jsonvaluate.value.ValueCoercion;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Semantics of the built-in membership, string and range operators.
 * All methods return false rather than fail on operands of the wrong shape.
 */
public final class BuiltinOperators {

    private BuiltinOperators() {
    }

    /**
     * True if the value equals any element of a sequence, any key of a map,
     * or is a substring of a string collection.
     */
    public static boolean isIn(Object value, Object collection) {
        if (collection == null) {
            return false;
        }
        if (collection instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                if (ValueCoercion.isEqual(value, key)) {
                    return true;
                }
            }
            return false;
        }
        if (collection instanceof CharSequence text) {
            return text.toString().contains(ValueCoercion.toString(value));
        }

        Optional<List<Object>> elements = ValueCoercion.toSequence(collection);
        if (elements.isEmpty()) {
            return false;
        }
        for (Object element : elements.get()) {
            if (ValueCoercion.isEqual(value, element)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Substring test on the string forms of both operands.
     */
    public static boolean contains(Object haystack, Object needle) {
        if (haystack == null || needle == null) {
            return false;
        }
        return ValueCoercion.toString(haystack).contains(ValueCoercion.toString(needle));
    }

    /**
     * SQL LIKE match: {@code %} matches any run of characters, {@code _} any single character.
     * The pattern must match the whole string. Every other character is literal.
     */
    public static boolean like(Object value, Object pattern, boolean ignoreCase) {
        if (value == null || pattern == null) {
            return false;
        }

        String text = ValueCoercion.toString(value);
        String sqlPattern = ValueCoercion.toString(pattern);
        if (ignoreCase) {
            text = text.toLowerCase(Locale.ROOT);
            sqlPattern = sqlPattern.toLowerCase(Locale.ROOT);
        }
        return matchesWildcard(text.codePoints().toArray(), sqlPattern.codePoints().toArray());
    }

    /**
     * Greedy wildcard match that only ever backtracks to the most recent {@code %},
     * so the cost is bounded by {@code text.length * pattern.length}.
     */
    static boolean matchesWildcard(int[] text, int[] pattern) {
        int t = 0;
        int p = 0;
        int lastPercent = -1;
        int resumeAt = 0;

        while (t < text.length) {
            if (p < pattern.length && pattern[p] == '%') {
                lastPercent = p++;
                resumeAt = t;
            } else if (p < pattern.length && (pattern[p] == '_' || pattern[p] == text[t])) {
                p++;
                t++;
            } else if (lastPercent >= 0) {
                // Let the last % absorb one more character and retry from there
                p = lastPercent + 1;
                t = ++resumeAt;
            } else {
                return false;
            }
        }

        while (p < pattern.length && pattern[p] == '%') {
            p++;
        }
        return p == pattern.length;
    }

    public static boolean startsWith(Object value, Object prefix) {
        if (value == null || prefix == null) {
            return false;
        }
        return ValueCoercion.toString(value).startsWith(ValueCoercion.toString(prefix));
    }

    public static boolean endsWith(Object value, Object suffix) {
        if (value == null || suffix == null) {
            return false;
        }
        return ValueCoercion.toString(value).endsWith(ValueCoercion.toString(suffix));
    }

    /**
     * Inclusive range test. {@code bounds} must be a two-element sequence {@code [min, max]}.
     */
    public static boolean between(Object value, Object bounds) {
        if (value == null || bounds == null) {
            return false;
        }

        Optional<List<Object>> range = ValueCoercion.toSequence(bounds);
        if (range.isEmpty() || range.get().size() != 2) {
            return false;
        }

        Object min = range.get().get(0);
        Object max = range.get().get(1);
        return ValueCoercion.compareValues(value, min) >= 0
                && ValueCoercion.compareValues(value, max) <= 0;
    }
}
