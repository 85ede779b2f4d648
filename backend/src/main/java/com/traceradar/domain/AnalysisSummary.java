package com.traceradar.domain;

/**
 * Denormalized rollup of one analysis.
 */
public record AnalysisSummary(
        int totalCalls,
        long totalGas,
        int errorCount,
        int trackedCalls,
        int transferCount,
        double complexityScore,
        int uniqueContracts,
        int maxDepth,
        long trackedGas,
        double trackedGasPercentage
) {

    public static AnalysisSummary empty() {
        return new AnalysisSummary(0, 0L, 0, 0, 0, 0.0, 0, 0, 0L, 0.0);
    }
}
