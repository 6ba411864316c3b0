package com.taxitelemetry.shared.util;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Explicit, fallible number parsing for loosely typed trip attributes.
 *
 * Accepted inputs: any {@link Number} and any string holding a finite decimal
 * literal (surrounding whitespace ignored). Booleans, blanks, NaN, infinities and
 * literals beyond the range of a double are not numbers. Doubles are converted through their shortest decimal form, so
 * {@code 8.2} becomes {@code 8.2} and not the binary expansion.
 */
public final class NumericParsing {

    private NumericParsing() {}

    public static Optional<BigDecimal> tryDecimal(Object value) {
        if (value == null || value instanceof Boolean) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal decimal) {
            return finite(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return finite(new BigDecimal(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<BigDecimal> finite(BigDecimal decimal) {
        return Double.isFinite(decimal.doubleValue()) ? Optional.of(decimal) : Optional.empty();
    }

    public static boolean isNumeric(Object value) {
        return tryDecimal(value).isPresent();
    }

    public static BigDecimal toDecimal(Object value, BigDecimal fallback) {
        return tryDecimal(value).orElse(fallback);
    }

    public static Double toDouble(Object value, double fallback) {
        return tryDecimal(value).map(BigDecimal::doubleValue).orElse(fallback);
    }

    /** Fractional input is truncated toward zero; values outside the int range fall back. */
    public static Integer toInteger(Object value, int fallback) {
        Optional<BigDecimal> decimal = tryDecimal(value);
        if (decimal.isEmpty()) {
            return fallback;
        }
        try {
            return decimal.get().toBigInteger().intValueExact();
        } catch (ArithmeticException e) {
            return fallback;
        }
    }

    /** Exact decimal form of a coordinate or distance; {@code null} stays {@code null}. */
    public static BigDecimal exact(Double value) {
        return value == null ? null : BigDecimal.valueOf(value);
    }
}
