package com.traceradar.analysis;

/**
 * Thrown before any fetch when a transaction hash is not 0x followed by 64 hex digits.
 */
public class InvalidTransactionHashException extends RuntimeException {

    private final String txHash;

    public InvalidTransactionHashException(String txHash) {
        super("Invalid transaction hash: " + txHash);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
