package com.jsonvaluate.value;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Conversions from dynamically typed values into canonical numeric, string,
 * boolean and temporal forms. Every built-in operator compares the coerced forms.
 * <p>
 * All methods are pure and accept any value, including null.
 */
public final class ValueCoercion {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern INFINITY = Pattern.compile("[+-]?(?i:inf|infinity)");
    private static final Pattern NAN = Pattern.compile("(?i:nan)");

    private static final LocalDate TIME_ONLY_DATE = LocalDate.of(0, 1, 1);

    /**
     * Accepted textual time layouts, tried in order. First match wins.
     */
    private static final List<Function<String, Instant>> TIME_LAYOUTS = List.of(
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            text -> LocalDateTime.parse(text, strict("uuuu-MM-dd HH:mm:ss")).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text, strict("uuuu-MM-dd")).atStartOfDay().toInstant(ZoneOffset.UTC),
            text -> LocalTime.parse(text, strict("HH:mm:ss")).atDate(TIME_ONLY_DATE).toInstant(ZoneOffset.UTC)
    );

    private ValueCoercion() {
    }

    /**
     * Convert a value to a double.
     * Any numeric type is widened; a string converts only if the whole string is a number.
     *
     * @param value value to convert
     * @return numeric value, or empty if the value is not numeric
     */
    public static Optional<Double> toNumber(Object value) {
        return switch (ValueKind.of(value)) {
            case INTEGER, FLOAT -> Optional.of(((Number) value).doubleValue());
            case STRING -> parseNumber(value.toString());
            default -> Optional.empty();
        };
    }

    private static Optional<Double> parseNumber(String text) {
        if (DECIMAL.matcher(text).matches()) {
            double parsed = Double.parseDouble(text);
            // Out-of-range literals are rejected rather than rounded to infinity
            return Double.isInfinite(parsed) ? Optional.empty() : Optional.of(parsed);
        }
        if (INFINITY.matcher(text).matches()) {
            return Optional.of(text.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        if (NAN.matcher(text).matches()) {
            return Optional.of(Double.NaN);
        }
        return Optional.empty();
    }

    /**
     * Convert a value to its string form. Null becomes the empty string.
     *
     * @param value value to convert
     * @return string form, never null
     */
    public static String toString(Object value) {
        return switch (ValueKind.of(value)) {
            case ABSENT -> "";
            case FLOAT -> formatFloating((Number) value);
            case SEQUENCE -> value.getClass().isArray()
                    ? String.valueOf(toSequence(value).orElse(List.of()))
                    : value.toString();
            default -> value.toString();
        };
    }

    private static String formatFloating(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        double d = number.doubleValue();
        String shortest = number instanceof Float ? Float.toString(number.floatValue()) : Double.toString(d);
        double magnitude = Math.abs(d);
        if (Double.isFinite(d) && (d == 0 || (magnitude >= 1e-4 && magnitude < 1e21))) {
            return new BigDecimal(shortest).stripTrailingZeros().toPlainString();
        }
        return shortest;
    }

    /**
     * Convert a value to a boolean.
     * Strings are true only when equal to "true" ignoring case; numbers when non-zero;
     * anything else when it is not empty.
     *
     * @param value value to convert
     * @return boolean form
     */
    public static boolean toBool(Object value) {
        return switch (ValueKind.of(value)) {
            case ABSENT -> false;
            case BOOLEAN -> (Boolean) value;
            case STRING -> "true".equalsIgnoreCase(value.toString());
            case INTEGER -> value instanceof BigInteger big ? big.signum() != 0 : ((Number) value).longValue() != 0;
            case FLOAT -> value instanceof BigDecimal big ? big.signum() != 0 : ((Number) value).doubleValue() != 0;
            default -> !isEmpty(value);
        };
    }

    /**
     * Check whether a value is empty: null, a zero-length string, an empty
     * collection, array or map, or an unset {@link Optional}.
     *
     * @param value value to check
     * @return true if empty
     */
    public static boolean isEmpty(Object value) {
        return switch (ValueKind.of(value)) {
            case ABSENT -> true;
            case STRING -> value.toString().isEmpty();
            case SEQUENCE -> value instanceof Collection<?> collection
                    ? collection.isEmpty()
                    : Array.getLength(value) == 0;
            case MAPPING -> ((Map<?, ?>) value).isEmpty();
            case OTHER -> value instanceof Optional<?> optional && optional.isEmpty();
            default -> false;
        };
    }

    /**
     * Convert a value to an instant.
     * Temporal values pass through (local values are read as UTC); strings are parsed
     * against RFC 3339, {@code yyyy-MM-dd HH:mm:ss}, {@code yyyy-MM-dd} and {@code HH:mm:ss};
     * a {@link Long} is read as Unix epoch seconds.
     *
     * @param value value to convert
     * @return instant, or empty if the value is not temporal
     */
    public static Optional<Instant> toTime(Object value) {
        if (value instanceof Long seconds) {
            return seconds >= Instant.MIN.getEpochSecond() && seconds <= Instant.MAX.getEpochSecond()
                    ? Optional.of(Instant.ofEpochSecond(seconds))
                    : Optional.empty();
        }
        return switch (ValueKind.of(value)) {
            case INSTANT -> Optional.of(temporalToInstant(value));
            case STRING -> parseTime(value.toString());
            default -> Optional.empty();
        };
    }

    private static Instant temporalToInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        return Instant.ofEpochMilli(((Date) value).getTime());
    }

    private static Optional<Instant> parseTime(String text) {
        for (Function<String, Instant> layout : TIME_LAYOUTS) {
            Optional<Instant> parsed = tryLayout(layout, text);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> tryLayout(Function<String, Instant> layout, String text) {
        try {
            return Optional.of(layout.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * View a collection or array as a list of its elements.
     *
     * @param value value to convert
     * @return elements in iteration order, or empty if the value is not a sequence
     */
    public static Optional<List<Object>> toSequence(Object value) {
        if (value instanceof Collection<?> collection) {
            return Optional.of(new ArrayList<>(collection));
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return Optional.of(elements);
        }
        return Optional.empty();
    }

    /**
     * Compare two values, returning -1, 0 or 1.
     * Numeric comparison is used when both sides are numeric, temporal comparison
     * when both sides are temporal, and string comparison otherwise.
     *
     * @param left  left operand
     * @param right right operand
     * @return sign of the comparison
     */
    public static int compareValues(Object left, Object right) {
        Optional<Double> leftNumber = toNumber(left);
        if (leftNumber.isPresent()) {
            Optional<Double> rightNumber = toNumber(right);
            if (rightNumber.isPresent()) {
                double a = leftNumber.get();
                double b = rightNumber.get();
                return a < b ? -1 : (a > b ? 1 : 0);
            }
        }

        Optional<Instant> leftTime = toTime(left);
        if (leftTime.isPresent()) {
            Optional<Instant> rightTime = toTime(right);
            if (rightTime.isPresent()) {
                return Integer.signum(leftTime.get().compareTo(rightTime.get()));
            }
        }

        return Integer.signum(toString(left).compareTo(toString(right)));
    }

    /**
     * Loose equality: deep equality first, then numeric equality when both sides
     * are numeric, then equality of the string forms.
     *
     * @param left  left operand
     * @param right right operand
     * @return true if the values are considered equal
     */
    public static boolean isEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (Objects.deepEquals(left, right)) {
            return true;
        }

        Optional<Double> leftNumber = toNumber(left);
        if (leftNumber.isPresent()) {
            Optional<Double> rightNumber = toNumber(right);
            if (rightNumber.isPresent()) {
                return leftNumber.get().doubleValue() == rightNumber.get().doubleValue();
            }
        }

        return toString(left).equals(toString(right));
    }
}
