package com.traceradar.analysis.gas;

public enum EfficiencyFlag {
    EXCELLENT,
    GOOD,
    AVERAGE,
    POOR,
    UNKNOWN
}
