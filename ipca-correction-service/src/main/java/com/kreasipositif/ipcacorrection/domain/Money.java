package com.kreasipositif.ipcacorrection.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-precision arithmetic shared by every monetary calculation.
 */
public final class Money {

    public static final int SCALE = 15;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value == null ? null : value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal multiply(BigDecimal value, BigDecimal rate) {
        return round(orZero(value).multiply(orZero(rate)));
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /** Converts a monthly percentage (4.5) into a correction factor (1.045). */
    public static BigDecimal factorFromPercent(BigDecimal percent) {
        return BigDecimal.ONE.add(percent.movePointLeft(2));
    }
}
