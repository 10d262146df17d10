package com.formulagrid.app.services;

import java.math.BigDecimal;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Conversions between cell text and doubles.
 */
final class Numbers {

    // Plain decimal, optionally signed, optionally with an exponent. No "NaN", "Infinity" or hex.
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private Numbers() {
    }

    /**
     * Shortest decimal text for a finite value, without exponent or trailing zeros:
     * 8.0 -> "8", 2.50 -> "2.5", -0.0 -> "0".
     */
    static String format(double value) {
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Reads a display value as a number; empty for blank, textual or non-finite input.
     */
    static OptionalDouble parse(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        String trimmed = text.trim();
        if (!NUMBER.matcher(trimmed).matches()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(trimmed);
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
