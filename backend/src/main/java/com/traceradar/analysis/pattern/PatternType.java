package com.traceradar.analysis.pattern;

/**
 * Behavioural classification of a transaction.
 */
public enum PatternType {
    SIMPLE_TRANSFER("simple_transfer"),
    MULTI_TRANSFER("multi_transfer"),
    APPROVAL_FLOW("approval_flow"),
    SUPPLY_CHANGE("supply_change"),
    SWAP_OPERATION("swap_operation"),
    LIQUIDITY_PROVISION("liquidity_provision"),
    BRIDGE_OPERATION("bridge_operation"),
    UNKNOWN("unknown");

    private final String label;

    PatternType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
