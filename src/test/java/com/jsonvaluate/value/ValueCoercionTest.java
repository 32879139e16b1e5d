package com.jsonvaluate.value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValueCoercion.
 */
class ValueCoercionTest {

    @Nested
    @DisplayName("toNumber")
    class ToNumber {

        @Test
        @DisplayName("Should widen every numeric type to double")
        void shouldWidenNumericTypes() {
            assertEquals(Optional.of(5.0), ValueCoercion.toNumber(5));
            assertEquals(Optional.of(5.0), ValueCoercion.toNumber(5L));
            assertEquals(Optional.of(1.5), ValueCoercion.toNumber(1.5f));
            assertEquals(Optional.of(2.5), ValueCoercion.toNumber(new BigDecimal("2.5")));
            assertEquals(Optional.of(3.0), ValueCoercion.toNumber((short) 3));
        }

        @ParameterizedTest
        @CsvSource({
                "42, 42.0",
                "3.14, 3.14",
                "-1e3, -1000.0",
                "+7, 7.0",
                ".5, 0.5",
                "10., 10.0"
        })
        @DisplayName("Should parse strings that are entirely numeric")
        void shouldParseNumericStrings(String text, double expected) {
            assertEquals(Optional.of(expected), ValueCoercion.toNumber(text));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " 42", "42 ", "42abc", "1d", "2f", "0x10", "1e400", "abc", "1,000"})
        @DisplayName("Should reject partially numeric or out of range strings")
        void shouldRejectNonNumericStrings(String text) {
            assertTrue(ValueCoercion.toNumber(text).isEmpty());
        }

        @Test
        @DisplayName("Should accept infinity and NaN literals")
        void shouldAcceptSpecialLiterals() {
            assertEquals(Optional.of(Double.POSITIVE_INFINITY), ValueCoercion.toNumber("Inf"));
            assertEquals(Optional.of(Double.NEGATIVE_INFINITY), ValueCoercion.toNumber("-infinity"));
            assertTrue(ValueCoercion.toNumber("NaN").get().isNaN());
        }

        @Test
        @DisplayName("Should reject non-numeric types")
        void shouldRejectOtherTypes() {
            assertTrue(ValueCoercion.toNumber(null).isEmpty());
            assertTrue(ValueCoercion.toNumber(true).isEmpty());
            assertTrue(ValueCoercion.toNumber(List.of(1)).isEmpty());
        }
    }

    @Nested
    @DisplayName("toString")
    class ToStringForm {

        @Test
        @DisplayName("Should render null as empty string")
        void shouldRenderNullAsEmpty() {
            assertEquals("", ValueCoercion.toString(null));
        }

        @Test
        @DisplayName("Should render integral doubles without fraction")
        void shouldRenderDoubles() {
            assertEquals("25", ValueCoercion.toString(25.0));
            assertEquals("25.5", ValueCoercion.toString(25.5));
            assertEquals("100", ValueCoercion.toString(100.0));
            assertEquals("0", ValueCoercion.toString(0.0));
            assertEquals("1.0E21", ValueCoercion.toString(1.0e21));
        }

        @Test
        @DisplayName("Should use the value's own textual form")
        void shouldUseToString() {
            assertEquals("abc", ValueCoercion.toString("abc"));
            assertEquals("7", ValueCoercion.toString(7));
            assertEquals("true", ValueCoercion.toString(true));
            assertEquals("[a, b]", ValueCoercion.toString(List.of("a", "b")));
            assertEquals("[1, 2]", ValueCoercion.toString(new int[]{1, 2}));
        }
    }

    @Nested
    @DisplayName("toBool / isEmpty")
    class Truthiness {

        @Test
        @DisplayName("Should convert scalars to boolean")
        void shouldConvertScalars() {
            assertFalse(ValueCoercion.toBool(null));
            assertTrue(ValueCoercion.toBool(true));
            assertFalse(ValueCoercion.toBool(false));
            assertTrue(ValueCoercion.toBool("TRUE"));
            assertFalse(ValueCoercion.toBool("yes"));
            assertFalse(ValueCoercion.toBool(0));
            assertTrue(ValueCoercion.toBool(-2));
            assertFalse(ValueCoercion.toBool(0.0));
            assertTrue(ValueCoercion.toBool(0.1));
        }

        @Test
        @DisplayName("Should treat other values as true when not empty")
        void shouldUseEmptinessForOtherTypes() {
            assertFalse(ValueCoercion.toBool(List.of()));
            assertTrue(ValueCoercion.toBool(List.of(1)));
            assertFalse(ValueCoercion.toBool(Map.of()));
            assertTrue(ValueCoercion.toBool(new Object()));
        }

        @Test
        @DisplayName("Should detect empty values")
        void shouldDetectEmpty() {
            assertTrue(ValueCoercion.isEmpty(null));
            assertTrue(ValueCoercion.isEmpty(""));
            assertTrue(ValueCoercion.isEmpty(List.of()));
            assertTrue(ValueCoercion.isEmpty(new int[0]));
            assertTrue(ValueCoercion.isEmpty(Map.of()));
            assertTrue(ValueCoercion.isEmpty(Optional.empty()));

            assertFalse(ValueCoercion.isEmpty("x"));
            assertFalse(ValueCoercion.isEmpty(0));
            assertFalse(ValueCoercion.isEmpty(false));
            assertFalse(ValueCoercion.isEmpty(Optional.of("x")));
        }
    }

    @Nested
    @DisplayName("toTime")
    class ToTime {

        @Test
        @DisplayName("Should pass temporal values through")
        void shouldPassTemporalValues() {
            Instant instant = Instant.parse("2024-07-01T12:00:00Z");
            assertEquals(Optional.of(instant), ValueCoercion.toTime(instant));
            assertEquals(Optional.of(instant), ValueCoercion.toTime(Date.from(instant)));
            assertEquals(Optional.of(Instant.parse("2024-07-01T00:00:00Z")),
                    ValueCoercion.toTime(LocalDate.of(2024, 7, 1)));
        }

        @Test
        @DisplayName("Should parse supported layouts in order")
        void shouldParseLayouts() {
            assertEquals(Optional.of(Instant.parse("2024-07-01T12:00:00Z")),
                    ValueCoercion.toTime("2024-07-01T12:00:00Z"));
            assertEquals(Optional.of(Instant.parse("2024-07-01T05:00:00.123Z")),
                    ValueCoercion.toTime("2024-07-01T12:00:00.123+07:00"));
            assertEquals(Optional.of(Instant.parse("2024-07-01T12:00:00Z")),
                    ValueCoercion.toTime("2024-07-01 12:00:00"));
            assertEquals(Optional.of(Instant.parse("2024-07-01T00:00:00Z")),
                    ValueCoercion.toTime("2024-07-01"));
            assertEquals(Optional.of(LocalDate.of(0, 1, 1).atTime(12, 30).toInstant(ZoneOffset.UTC)),
                    ValueCoercion.toTime("12:30:00"));
        }

        @Test
        @DisplayName("Should read Long as epoch seconds")
        void shouldReadEpochSeconds() {
            assertEquals(Optional.of(Instant.ofEpochSecond(1719835200L)), ValueCoercion.toTime(1719835200L));
            assertTrue(ValueCoercion.toTime(1719835200).isEmpty());
        }

        @Test
        @DisplayName("Should reject invalid times")
        void shouldRejectInvalid() {
            assertTrue(ValueCoercion.toTime("not a date").isEmpty());
            assertTrue(ValueCoercion.toTime("2024-02-30").isEmpty());
            assertTrue(ValueCoercion.toTime(null).isEmpty());
            assertTrue(ValueCoercion.toTime(Long.MAX_VALUE).isEmpty());
        }
    }

    @Nested
    @DisplayName("compareValues / isEqual")
    class Comparison {

        @Test
        @DisplayName("Should compare numeric strings numerically")
        void shouldCompareNumericStrings() {
            assertTrue(ValueCoercion.compareValues("5", "10") < 0);
            assertEquals(1, ValueCoercion.compareValues(10, 9.5));
            assertEquals(0, ValueCoercion.compareValues(5, "5.0"));
        }

        @Test
        @DisplayName("Should compare plain strings lexicographically")
        void shouldCompareStrings() {
            assertTrue(ValueCoercion.compareValues("b", "a") > 0);
            assertEquals(-1, ValueCoercion.compareValues(null, "a"));
            assertEquals(1, ValueCoercion.compareValues(true, false));
        }

        @Test
        @DisplayName("Should compare temporal values when both sides are temporal")
        void shouldCompareTimes() {
            assertEquals(-1, ValueCoercion.compareValues("2024-01-01", "2024-06-01"));
            assertEquals(0, ValueCoercion.compareValues(
                    Instant.parse("2024-07-01T12:00:00Z"), "2024-07-01 12:00:00"));
        }

        @Test
        @DisplayName("Should not depend on argument position")
        void shouldBeAntisymmetric() {
            assertEquals(-ValueCoercion.compareValues("5", "10"), ValueCoercion.compareValues("10", "5"));
            assertEquals(-ValueCoercion.compareValues("10", "abc"), ValueCoercion.compareValues("abc", "10"));
        }

        @Test
        @DisplayName("Should apply loose equality")
        void shouldApplyLooseEquality() {
            assertTrue(ValueCoercion.isEqual(null, null));
            assertFalse(ValueCoercion.isEqual(null, 1));
            assertFalse(ValueCoercion.isEqual("", null));
            assertTrue(ValueCoercion.isEqual(25, "25"));
            assertTrue(ValueCoercion.isEqual(25, 25.0));
            assertTrue(ValueCoercion.isEqual(List.of(1, 2), List.of(1, 2)));
            assertTrue(ValueCoercion.isEqual(new int[]{1}, new int[]{1}));
            assertTrue(ValueCoercion.isEqual(true, "true"));
            assertFalse(ValueCoercion.isEqual("a", "b"));
        }
    }

    @Test
    @DisplayName("Should classify values by kind")
    void shouldClassifyValues() {
        assertEquals(ValueKind.ABSENT, ValueKind.of(null));
        assertEquals(ValueKind.BOOLEAN, ValueKind.of(true));
        assertEquals(ValueKind.INTEGER, ValueKind.of(1L));
        assertEquals(ValueKind.FLOAT, ValueKind.of(1.0));
        assertEquals(ValueKind.STRING, ValueKind.of("x"));
        assertEquals(ValueKind.INSTANT, ValueKind.of(Instant.EPOCH));
        assertEquals(ValueKind.SEQUENCE, ValueKind.of(new String[0]));
        assertEquals(ValueKind.MAPPING, ValueKind.of(Map.of()));
        assertEquals(ValueKind.OTHER, ValueKind.of(Optional.empty()));
    }
}
