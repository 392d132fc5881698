package com.listingpilot.infrastructure.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding, formatting and clamping shared by the scorers.
 * Ties round to the even digit, taken on the exact binary value of the double.
 */
public final class ScoreMath {

    private ScoreMath() {
    }

    public static double round1(double value) {
        return round(value, 1).doubleValue();
    }

    public static double round2(double value) {
        return round(value, 2).doubleValue();
    }

    /**
     * One-decimal text for messages, rounded like {@link #round1(double)}.
     */
    public static String format1(double value) {
        return round(value, 1).toPlainString();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Share of {@code part} in {@code total} as a percentage, 0 when there is no total.
     */
    public static double percent(int part, int total) {
        return total > 0 ? (double) part / total * 100.0 : 0.0;
    }

    private static BigDecimal round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN);
    }
}
