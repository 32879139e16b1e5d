package com.jsonvaluate.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in comparison operators. Identifiers are reserved and cannot be
 * overridden through the operator registry.
 */
public enum Operator {
    // Equality
    EQ("eq", "=="),
    NEQ("neq", "!="),

    // Ordering
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    BETWEEN("between"),
    NOT_BETWEEN("notbetween"),

    // Membership
    IN("in"),
    NIN("nin"),

    // String
    CONTAINS("contains"),
    NCONTAINS("ncontains"),
    LIKE("like"),
    ILIKE("ilike"),
    NLIKE("nlike"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith"),

    // Existence / state
    IS_NULL("isnull"),
    IS_NOT_NULL("isnotnull"),
    IS_EMPTY("isempty"),
    IS_NOT_EMPTY("isnotempty"),
    IS_TRUE("istrue"),
    IS_FALSE("isfalse");

    private static final Map<String, Operator> BY_ID;

    static {
        Map<String, Operator> byId = new HashMap<>();
        for (Operator operator : values()) {
            for (String id : operator.ids) {
                byId.put(id, operator);
            }
        }
        BY_ID = Collections.unmodifiableMap(byId);
    }

    private final String id;
    private final List<String> ids;

    Operator(String id, String... aliases) {
        List<String> all = new ArrayList<>();
        all.add(id);
        all.addAll(List.of(aliases));
        this.id = id;
        this.ids = List.copyOf(all);
    }

    /**
     * Canonical identifier, as used in serialized conditions.
     */
    public String id() {
        return id;
    }

    /**
     * Canonical identifier followed by any symbolic aliases.
     */
    public List<String> ids() {
        return ids;
    }

    /**
     * Existence/state operators are defined even when the key is absent from the data.
     */
    public boolean requiresKey() {
        return switch (this) {
            case IS_NULL, IS_NOT_NULL, IS_EMPTY, IS_NOT_EMPTY, IS_TRUE, IS_FALSE -> false;
            default -> true;
        };
    }

    /**
     * Resolve an identifier or alias. Matching is case-sensitive.
     *
     * @param id operator identifier
     * @return the built-in operator, or empty for custom/unknown identifiers
     */
    public static Optional<Operator> fromId(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(BY_ID.get(id));
    }

    public static boolean isBuiltin(String id) {
        return fromId(id).isPresent();
    }

    @Override
    public String toString() {
        return id;
    }
}
