package com.tradingagent.config;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Percent-like settings accept both 5 and 0.05; values above 1 are read as percentages. */
public final class PercentNormalizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private PercentNormalizer() {}

    public static BigDecimal toFraction(BigDecimal value) {
        if (value == null) {
            return null;
        }
        if (value.compareTo(BigDecimal.ONE) > 0) {
            return value.divide(HUNDRED, 6, RoundingMode.HALF_UP);
        }
        return value;
    }

    public static double toFraction(double value) {
        return value > 1.0 ? value / 100.0 : value;
    }
}
