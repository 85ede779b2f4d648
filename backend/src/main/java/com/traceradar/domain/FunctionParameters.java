package com.traceradar.domain;

import java.math.BigInteger;

/**
 * Named arguments decoded from calldata of a tracked contract call. Absent arguments are null.
 */
public record FunctionParameters(
        String to,
        String from,
        BigInteger amount,
        String spender,
        String owner,
        String account,
        String newOwner
) {

    private static final FunctionParameters EMPTY = new FunctionParameters(null, null, null, null, null, null, null);

    public static FunctionParameters empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return EMPTY.equals(this);
    }
}
