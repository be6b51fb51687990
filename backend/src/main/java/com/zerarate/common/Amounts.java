package com.zerarate.common;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Validation and parsing of decimal rates and amounts. All values stay in BigDecimal.
 */
public final class Amounts {

    private Amounts() {}

    /**
     * Parses a decimal string such as "0.10" or "5".
     *
     * @throws IllegalArgumentException when null, blank, malformed or negative
     */
    public static BigDecimal parseNonNegative(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must be a non-empty decimal string");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(value.strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a valid decimal: " + value, e);
        }
        return requireNonNegative(parsed, name);
    }

    /**
     * Any {@link Number}, parsed from its decimal string form so doubles keep their printed value.
     *
     * @throws IllegalArgumentException when null, not finite or negative
     */
    public static BigDecimal parseNonNegative(Number value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value instanceof BigDecimal decimal) {
            return requireNonNegative(decimal, name);
        }
        return parseNonNegative(value.toString(), name);
    }

    /**
     * @throws IllegalArgumentException when null or negative
     */
    public static BigDecimal requireNonNegative(BigDecimal value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value.toPlainString());
        }
        return value;
    }

    /**
     * Validates every entry of an identifier-to-rate table and returns an immutable copy.
     */
    public static Map<String, BigDecimal> requireRateTable(Map<String, BigDecimal> rates, String name) {
        if (rates == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        Map<String, BigDecimal> copy = new HashMap<>();
        rates.forEach((id, rate) -> copy.put(
                InstrumentIds.requireValid(id),
                requireNonNegative(rate, name + " for " + id)));
        return Map.copyOf(copy);
    }
}
