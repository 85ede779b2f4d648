package com.traceradar.analysis.compare;

public record GasComparison(
        long totalGasChange,
        double totalGasPercentageChange,
        boolean categoryChanged,
        ListDiff optimizationOpportunities,
        String summary
) {
}
