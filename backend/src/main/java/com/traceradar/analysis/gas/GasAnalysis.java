package com.traceradar.analysis.gas;

import com.traceradar.domain.GasUsageCategory;

import java.util.List;

public record GasAnalysis(
        long totalGas,
        GasUsageCategory category,
        List<ContractGasUsage> byContract,
        List<FunctionGasUsage> byFunction,
        List<GasDistributionEntry> distribution,
        List<GasBreakdownEntry> breakdown,
        List<EfficiencyMetric> efficiencyMetrics,
        List<OptimizationSuggestion> suggestions,
        List<BenchmarkComparison> benchmarkComparisons
) {

    public GasAnalysis {
        byContract = List.copyOf(byContract);
        byFunction = List.copyOf(byFunction);
        distribution = List.copyOf(distribution);
        breakdown = List.copyOf(breakdown);
        efficiencyMetrics = List.copyOf(efficiencyMetrics);
        suggestions = List.copyOf(suggestions);
        benchmarkComparisons = List.copyOf(benchmarkComparisons);
    }

    public static GasAnalysis empty() {
        return new GasAnalysis(0L, GasUsageCategory.LOW, List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of());
    }
}
