package com.traceradar.analysis.gas;

/**
 * Scored efficiency measure; score is 0-100, higher is better.
 */
public record EfficiencyMetric(String name, long value, String unit, int score, String description) {
}
