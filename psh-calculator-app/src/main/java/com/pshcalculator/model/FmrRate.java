package com.pshcalculator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;

/**
 * Payment standard and Fair Market Rent for one bedroom size.
 * Amounts in whole cents are held at scale 2; anything else is kept as given
 * and reported by {@link #isValid()}.
 */
public record FmrRate(
    BigDecimal paymentStandard,
    BigDecimal fmr
) {
    public FmrRate {
        paymentStandard = toCents(paymentStandard);
        fmr = toCents(fmr);
    }

    public static FmrRate of(long paymentStandard, long fmr) {
        return new FmrRate(Money.of(paymentStandard), Money.of(fmr));
    }

    @JsonIgnore
    public boolean isValid() {
        return isValidAmount(paymentStandard) && isValidAmount(fmr);
    }

    private static boolean isValidAmount(BigDecimal amount) {
        return amount != null && amount.signum() >= 0 && amount.scale() == Money.SCALE;
    }

    private static BigDecimal toCents(BigDecimal amount) {
        return amount != null && Money.hasWholeCents(amount) ? Money.normalize(amount) : amount;
    }
}
