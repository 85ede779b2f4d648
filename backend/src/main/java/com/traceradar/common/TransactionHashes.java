package com.traceradar.common;

import java.util.regex.Pattern;

/**
 * Transaction hash format: 0x followed by 64 hex digits.
 */
public final class TransactionHashes {

    private static final Pattern TX_HASH = Pattern.compile("^0x[a-fA-F0-9]{64}$");

    private TransactionHashes() {
    }

    public static boolean isValid(String txHash) {
        return txHash != null && TX_HASH.matcher(txHash).matches();
    }
}
