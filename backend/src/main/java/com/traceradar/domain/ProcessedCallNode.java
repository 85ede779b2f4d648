package com.traceradar.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * One normalized call from a transaction trace. Position in the tree is given by {@code traceAddress}
 * (depth = its length); parent/child links are derived by path prefix, never stored.
 *
 * @param index         zero-based position in the original trace
 * @param callType      upper-cased call kind, "UNKNOWN" when missing
 * @param valueWei      native value in wei
 * @param valueNative   native value in whole units (18 decimals)
 * @param tracked       true when {@code to} is a tracked contract
 * @param selector      4-byte selector of the input, null when input is shorter
 * @param error         error reported by the trace, null when the call succeeded
 */
public record ProcessedCallNode(
        int index,
        List<Integer> traceAddress,
        String callType,
        int depth,
        String from,
        String to,
        BigInteger valueWei,
        BigDecimal valueNative,
        long gasUsed,
        boolean tracked,
        String contractName,
        String functionName,
        FunctionCategory category,
        FunctionParameters parameters,
        String selector,
        String inputPreview,
        String outputPreview,
        String error
) {

    public ProcessedCallNode {
        traceAddress = traceAddress == null ? List.of() : List.copyOf(traceAddress);
        parameters = parameters == null ? FunctionParameters.empty() : parameters;
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    /** Lower-cased function name for substring heuristics; never null. */
    public String functionNameLower() {
        return functionName == null ? "" : functionName.toLowerCase();
    }

    public boolean functionNameContains(String fragment) {
        return functionName != null && functionName.contains(fragment);
    }
}
