package com.delta.screener.screening.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class ScoreMath {
    private ScoreMath() {
    }

    /**
     * Rounds the exact binary value of {@code value} half-even, so 2.675 stays 2.67.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double ratio(int numerator, int denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return (double) numerator / denominator;
    }
}
