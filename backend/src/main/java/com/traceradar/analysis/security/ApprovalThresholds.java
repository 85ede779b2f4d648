package com.traceradar.analysis.security;

import com.traceradar.common.TokenAmounts;

import java.math.BigInteger;

/**
 * Raw-amount thresholds for grading approvals and transfers of the tracked token.
 */
final class ApprovalThresholds {

    /** 2^256 - 2^128: anything at or above is treated as an unlimited allowance. */
    static final BigInteger INFINITE = BigInteger.TWO.pow(256).subtract(BigInteger.TWO.pow(128));

    private static final long LARGE_TOKENS = 1_000_000L;
    private static final long MODERATE_TOKENS = 10_000L;

    private ApprovalThresholds() {
    }

    static boolean isInfinite(BigInteger amount) {
        return amount != null && amount.compareTo(INFINITE) >= 0;
    }

    static BigInteger large(int decimals) {
        return BigInteger.valueOf(LARGE_TOKENS).multiply(TokenAmounts.unit(decimals));
    }

    static BigInteger moderate(int decimals) {
        return BigInteger.valueOf(MODERATE_TOKENS).multiply(TokenAmounts.unit(decimals));
    }
}
