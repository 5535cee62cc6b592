package com.infomedia.abacox.pnrquality.component.aggregation;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Percentages {

    public static final int SCALE = 2;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Percentages() {
    }

    /**
     * part / whole * 100, rounded half-up to two decimals and clamped to [0, 100].
     * An empty whole yields 0.
     */
    public static BigDecimal of(long part, long whole) {
        if (whole <= 0 || part <= 0) {
            return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        }
        BigDecimal value = BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(whole), SCALE, RoundingMode.HALF_UP);
        return value.min(HUNDRED.setScale(SCALE, RoundingMode.HALF_UP));
    }

    public static BigDecimal average(long sum, long count) {
        if (count <= 0) {
            return BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
    }
}
