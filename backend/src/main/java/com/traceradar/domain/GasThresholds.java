package com.traceradar.domain;

/**
 * Gas boundaries shared by the pattern rules, MEV tiers, security scan and gas analyzer.
 */
public final class GasThresholds {

    public static final long MODERATE = 100_000L;
    public static final long HIGH = 500_000L;
    public static final long VERY_HIGH = 1_000_000L;

    /** Single calls above this are reported as high-gas operations. */
    public static final long HIGH_SINGLE_CALL = 200_000L;

    /** Base cost of a plain transaction; calls reporting less are treated as near-zero gas. */
    public static final long BASE_TRANSACTION = 21_000L;

    private GasThresholds() {
    }

    /**
     * LOW below 100k, MODERATE up to 500k, HIGH up to 1M, VERY_HIGH above.
     */
    public static GasUsageCategory categorize(long gas) {
        if (gas > VERY_HIGH) {
            return GasUsageCategory.VERY_HIGH;
        }
        if (gas > HIGH) {
            return GasUsageCategory.HIGH;
        }
        if (gas >= MODERATE) {
            return GasUsageCategory.MODERATE;
        }
        return GasUsageCategory.LOW;
    }
}
