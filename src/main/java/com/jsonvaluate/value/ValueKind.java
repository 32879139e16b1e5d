package com.jsonvaluate.value;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Closed classification of the dynamically typed values found in data records
 * and condition operands. Coercion rules switch on the kind instead of
 * inspecting runtime types in every operator.
 */
public enum ValueKind {
    ABSENT,
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING,
    INSTANT,
    SEQUENCE,
    MAPPING,
    OTHER;

    /**
     * Classify a value.
     *
     * @param value any value, possibly null
     * @return the value's kind, never null
     */
    public static ValueKind of(Object value) {
        if (value == null) {
            return ABSENT;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger
                || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return INTEGER;
        }
        if (value instanceof Number) {
            return FLOAT;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return STRING;
        }
        if (value instanceof Instant || value instanceof OffsetDateTime || value instanceof ZonedDateTime
                || value instanceof LocalDateTime || value instanceof LocalDate || value instanceof Date) {
            return INSTANT;
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return SEQUENCE;
        }
        if (value instanceof Map<?, ?>) {
            return MAPPING;
        }
        return OTHER;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
}
