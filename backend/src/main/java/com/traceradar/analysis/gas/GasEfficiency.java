package com.traceradar.analysis.gas;

/**
 * Efficiency of a gas amount against its function benchmark; pctDiff and comparedToMedian are relative to the median.
 */
public record GasEfficiency(EfficiencyFlag flag, double pctDiff, long comparedToMedian) {

    static final GasEfficiency UNKNOWN = new GasEfficiency(EfficiencyFlag.UNKNOWN, 0.0, 0L);
}
