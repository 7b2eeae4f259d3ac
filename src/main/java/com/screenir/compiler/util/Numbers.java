package com.screenir.compiler.util;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;

/**
 * Formats numbers for token keys and mapping keys.
 */
@UtilityClass
public class Numbers {

    /**
     * Integral values print without a fraction ({@code 16} not {@code 16.0}); others
     * print their shortest exact decimal form.
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
