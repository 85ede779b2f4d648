package com.traceradar.analysis.gas;

/**
 * Observed gas distribution of one function: 25th percentile, median and 75th percentile.
 */
public record GasBenchmark(String functionName, long p25, long median, long p75) {

    public EfficiencyFlag grade(long gasUsed) {
        if (gasUsed <= p25) {
            return EfficiencyFlag.EXCELLENT;
        }
        if (gasUsed <= median) {
            return EfficiencyFlag.GOOD;
        }
        if (gasUsed <= p75) {
            return EfficiencyFlag.AVERAGE;
        }
        return EfficiencyFlag.POOR;
    }
}
