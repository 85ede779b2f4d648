package com.traceradar.common;

/**
 * Percentage helpers that never produce NaN or Infinity.
 */
public final class Percentages {

    private Percentages() {
    }

    /**
     * part / total * 100, or 0 when total is not positive.
     */
    public static double of(double part, double total) {
        if (total <= 0) {
            return 0.0;
        }
        return part / total * 100.0;
    }

    /**
     * Relative change from baseline to current in percent.
     * 0 when both are zero, 100 when only the baseline is zero.
     */
    public static double change(double baseline, double current) {
        if (baseline == 0) {
            return current == 0 ? 0.0 : 100.0;
        }
        double result = (current - baseline) / baseline * 100.0;
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return 0.0;
        }
        return result;
    }

    /**
     * Rounds to two decimals.
     */
    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
