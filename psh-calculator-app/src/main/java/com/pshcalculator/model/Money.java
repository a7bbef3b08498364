package com.pshcalculator.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency helpers. All amounts are held at scale 2 (whole cents).
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
    }

    public static BigDecimal of(long dollars) {
        return BigDecimal.valueOf(dollars).setScale(SCALE);
    }

    public static BigDecimal of(String amount) {
        return new BigDecimal(amount).setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * Rescales an amount known to have at most two fractional digits.
     * Throws ArithmeticException if cents would be lost.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public static boolean hasWholeCents(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() <= SCALE;
    }
}
