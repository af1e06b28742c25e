package com.flagship.marketplace.listing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * ISO-4217 currencies accepted for listings, with their minor-unit digits.
 */
public enum CurrencyCode {
    USD(2),
    EUR(2),
    GBP(2),
    INR(2),
    JPY(0);

    private final int fractionDigits;

    CurrencyCode(int fractionDigits) {
        this.fractionDigits = fractionDigits;
    }

    public int getFractionDigits() {
        return fractionDigits;
    }

    /**
     * Rescales an amount to this currency's minor units without rounding.
     *
     * @throws ArithmeticException if the amount has more decimals than the currency allows
     */
    public BigDecimal normalize(BigDecimal amount) {
        return amount.setScale(fractionDigits, RoundingMode.UNNECESSARY);
    }
}
