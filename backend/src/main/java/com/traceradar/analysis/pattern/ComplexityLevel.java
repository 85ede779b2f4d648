package com.traceradar.analysis.pattern;

public enum ComplexityLevel {
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    static ComplexityLevel of(double score) {
        if (score < 20) {
            return LOW;
        }
        if (score < 40) {
            return MEDIUM;
        }
        if (score < 70) {
            return HIGH;
        }
        return VERY_HIGH;
    }
}
