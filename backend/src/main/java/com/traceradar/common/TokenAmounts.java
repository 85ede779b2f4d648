package com.traceradar.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Decimal scaling and display formatting for raw on-chain integer amounts.
 */
public final class TokenAmounts {

    /** Native currency decimals (wei per ether). */
    public static final int NATIVE_DECIMALS = 18;

    private TokenAmounts() {
    }

    /**
     * Raw integer amount divided by 10^decimals. Null raw amount = ZERO.
     */
    public static BigDecimal scale(BigInteger raw, int decimals) {
        if (raw == null) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(raw).movePointLeft(Math.max(0, decimals)).stripTrailingZeros();
    }

    /**
     * 10^decimals as an integer, e.g. one whole token in raw units.
     */
    public static BigInteger unit(int decimals) {
        return BigInteger.TEN.pow(Math.max(0, decimals));
    }

    /**
     * Grouped display form with at most two fraction digits, e.g. "1,234,567.5".
     */
    public static String format(BigDecimal amount) {
        if (amount == null) {
            return "0";
        }
        DecimalFormat format = new DecimalFormat("#,##0.##", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(amount);
    }

    /**
     * Grouped display form for integer counts, e.g. "60,000".
     */
    public static String format(long value) {
        return String.format(Locale.US, "%,d", value);
    }
}
