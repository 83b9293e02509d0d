package com.prediction.worthhub.worth_hub.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for prediction and truth values.
 *
 * All real-world values are stored as signed 64-bit integers scaled by
 * {@link #PRECISION} (150.25 is stored as 150_250_000). Settlement math never
 * touches floating point; this class exists for the edges of the system
 * (request parsing, logging, tests).
 */
public final class FixedPoint {

    /** Scale of every fixed-point value: 1e6. */
    public static final long PRECISION = 1_000_000L;

    public static final int SCALE = 6;

    private FixedPoint() {
    }

    /**
     * Parse a decimal string ("150.25") into fixed-point. Digits beyond the
     * sixth decimal are rounded HALF_EVEN.
     */
    public static long of(String decimal) {
        if (decimal == null || decimal.trim().isEmpty()) {
            throw new IllegalArgumentException("Value string cannot be null or empty");
        }
        try {
            return of(new BigDecimal(decimal.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value format: " + decimal, e);
        }
    }

    public static long of(BigDecimal value) {
        try {
            return value.setScale(SCALE, RoundingMode.HALF_EVEN)
                    .movePointRight(SCALE)
                    .longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Value out of fixed-point range: " + value, e);
        }
    }

    /**
     * Convert back to a decimal (display only).
     */
    public static BigDecimal toDecimal(long fixedPoint) {
        return BigDecimal.valueOf(fixedPoint, SCALE);
    }

    public static String format(long fixedPoint) {
        return toDecimal(fixedPoint).toPlainString();
    }
}
