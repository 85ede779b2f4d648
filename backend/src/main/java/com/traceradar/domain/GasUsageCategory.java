package com.traceradar.domain;

/**
 * Bucket of a gas amount on the shared thresholds.
 */
public enum GasUsageCategory {
    LOW,
    MODERATE,
    HIGH,
    VERY_HIGH
}
