package com.traceradar.ingestion.adapter;

/**
 * The node answered but has no trace for the transaction (unknown hash, or tracing unavailable for it).
 */
public class TraceNotFoundException extends RuntimeException {

    private final String txHash;

    public TraceNotFoundException(String txHash) {
        super("No trace found for transaction " + txHash);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
