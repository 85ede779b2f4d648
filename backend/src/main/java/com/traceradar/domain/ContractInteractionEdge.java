package com.traceradar.domain;

/**
 * Aggregated calls from one address to another within a transaction.
 */
public record ContractInteractionEdge(String from, String to, int callCount, long totalGas) {
}
