package com.traceradar.analysis.gas;

/**
 * Average gas of a benchmarked function in this transaction against its benchmark median.
 */
public record BenchmarkComparison(
        String functionName,
        long actualGas,
        long benchmarkGas,
        EfficiencyFlag efficiency,
        long difference,
        double percentageDiff
) {
}
