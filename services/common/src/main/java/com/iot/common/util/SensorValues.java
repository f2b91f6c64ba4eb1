package com.iot.common.util;

import java.util.Collection;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Null-tolerant handling of raw sensor values.
 *
 * A raw value is usable when it is a finite number, or a string that
 * parses to one. Everything else (null, booleans, nested JSON, "abc",
 * NaN, Infinity) is ignored.
 */
public final class SensorValues {

    // Plain decimal notation; rejects Java-only forms such as "1f" or "0x1p3"
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private SensorValues() {} // Prevent instantiation

    /**
     * Returns true if the raw value converts to a finite double.
     */
    public static boolean isValid(Object value) {
        return toDouble(value).isPresent();
    }

    /**
     * Converts a raw value to a finite double, or empty if it is not usable.
     */
    public static OptionalDouble toDouble(Object value) {
        double converted;
        if (value instanceof Number number) {
            converted = number.doubleValue();
        } else if (value instanceof String text) {
            String trimmed = text.trim();
            if (!DECIMAL.matcher(trimmed).matches()) {
                return OptionalDouble.empty();
            }
            converted = Double.parseDouble(trimmed);
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(converted) ? OptionalDouble.of(converted) : OptionalDouble.empty();
    }

    /**
     * Mean of the usable values, or empty when none are usable.
     * An empty result is distinct from a mean of 0.0.
     */
    public static OptionalDouble safeMean(Collection<?> values) {
        if (values == null) {
            return OptionalDouble.empty();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(SensorValues::toDouble)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .average();
    }
}
