package com.traceradar.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Token movement extracted from a tracked contract call. Mint source and burn destination use the zero address.
 */
public record TokenTransferEvent(
        TransferKind kind,
        String from,
        String to,
        BigInteger rawAmount,
        BigDecimal amount,
        List<Integer> traceAddress,
        int sequenceIndex
) {

    public TokenTransferEvent {
        traceAddress = traceAddress == null ? List.of() : List.copyOf(traceAddress);
    }
}
