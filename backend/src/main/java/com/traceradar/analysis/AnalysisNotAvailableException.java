package com.traceradar.analysis;

/**
 * A comparison needs a completed analysis that is not in the cache.
 */
public class AnalysisNotAvailableException extends RuntimeException {

    private final String txHash;

    public AnalysisNotAvailableException(String txHash) {
        super("No completed analysis available for transaction " + txHash);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
