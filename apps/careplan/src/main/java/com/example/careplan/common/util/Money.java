package com.example.careplan.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding rule for every amount that leaves the cost engine.
 */
public final class Money {

    public static final BigDecimal ZERO = cents(BigDecimal.ZERO);

    private Money() {}

    public static BigDecimal cents(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
