package com.jsonvaluate.condition;

import java.util.Locale;
import java.util.Optional;

/**
 * Logical connective combining condition results.
 */
public enum Logic {
    AND,
    OR;

    /**
     * Parse a connective name, ignoring case.
     *
     * @param name "AND" or "OR" in any case
     * @return the connective, or empty if the name is blank or unknown
     */
    public static Optional<Logic> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "AND" -> Optional.of(AND);
            case "OR" -> Optional.of(OR);
            default -> Optional.empty();
        };
    }

    /**
     * Combine two results with this connective.
     */
    public boolean apply(boolean left, boolean right) {
        return this == OR ? left || right : left && right;
    }
}
