package com.traceradar.analysis.compare;

public enum DifferenceCategory {
    PATTERN,
    GAS,
    SECURITY,
    CONTRACTS
}
