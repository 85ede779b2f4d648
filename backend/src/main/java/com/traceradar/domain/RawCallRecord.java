package com.traceradar.domain;

import java.util.List;

/**
 * One call/create/self-destruct entry as reported by the node's tracer, fields still in wire form (hex strings).
 *
 * @param createdAddress new contract address reported in the result of a contract creation
 */
public record RawCallRecord(
        String callType,
        String from,
        String to,
        String createdAddress,
        String value,
        String input,
        String output,
        String gasUsed,
        List<Integer> traceAddress,
        String error
) {

    public RawCallRecord {
        traceAddress = traceAddress == null ? List.of() : List.copyOf(traceAddress);
    }
}
