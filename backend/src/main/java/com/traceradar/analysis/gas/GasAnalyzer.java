package com.traceradar.analysis.gas;

import com.traceradar.common.Percentages;
import com.traceradar.common.TokenAmounts;
import com.traceradar.domain.FunctionCategory;
import com.traceradar.domain.GasThresholds;
import com.traceradar.domain.GasUsageCategory;
import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Gas accounting of one trace: partitions, benchmark grading, efficiency metrics and optimisation suggestions.
 */
@Component
public class GasAnalyzer {

    static final String DIST_TOKEN = "PYUSD Token";
    static final String DIST_SUPPLY = "Supply Control";
    static final String DIST_OTHER_TRACKED = "Other PYUSD";
    static final String DIST_EXTERNAL = "External Contract";

    private static final int BATCH_TRANSFER_MIN = 4;
    private static final int MANY_CALLS = 20;
    private static final int DEEP_STACK = 5;

    public GasAnalysis analyze(List<ProcessedCallNode> nodes) {
        if (nodes.isEmpty()) {
            return GasAnalysis.empty();
        }
        long totalGas = nodes.stream().mapToLong(ProcessedCallNode::gasUsed).sum();
        return new GasAnalysis(
                totalGas,
                GasThresholds.categorize(totalGas),
                byContract(nodes, totalGas),
                byFunction(nodes, totalGas),
                distribution(nodes, totalGas),
                breakdown(nodes, totalGas),
                efficiencyMetrics(nodes, totalGas),
                suggestions(nodes, totalGas),
                benchmarkComparisons(nodes));
    }

    List<ContractGasUsage> byContract(List<ProcessedCallNode> nodes, long totalGas) {
        Map<String, List<ProcessedCallNode>> grouped = nodes.stream()
                .filter(n -> n.to() != null && !n.to().isBlank())
                .collect(Collectors.groupingBy(ProcessedCallNode::to, LinkedHashMap::new, Collectors.toList()));
        return grouped.entrySet().stream()
                .map(e -> {
                    long gas = e.getValue().stream().mapToLong(ProcessedCallNode::gasUsed).sum();
                    return new ContractGasUsage(e.getKey(), e.getValue().get(0).contractName(), gas, e.getValue().size(),
                            Percentages.of(gas, totalGas));
                })
                .sorted(Comparator.comparingLong(ContractGasUsage::gasUsed).reversed())
                .toList();
    }

    List<FunctionGasUsage> byFunction(List<ProcessedCallNode> nodes, long totalGas) {
        Map<String, List<ProcessedCallNode>> grouped = nodes.stream()
                .filter(n -> n.functionName() != null && !KnownFunctions.NOT_DECODED.equals(n.functionName()))
                .collect(Collectors.groupingBy(ProcessedCallNode::functionName, LinkedHashMap::new, Collectors.toList()));
        return grouped.entrySet().stream()
                .map(e -> {
                    long gas = e.getValue().stream().mapToLong(ProcessedCallNode::gasUsed).sum();
                    long average = gas / e.getValue().size();
                    return new FunctionGasUsage(e.getKey(), gas, e.getValue().size(), Percentages.of(gas, totalGas),
                            GasBenchmarkTable.grade(average, e.getKey()));
                })
                .sorted(Comparator.comparingLong(FunctionGasUsage::gasUsed).reversed())
                .toList();
    }

    List<GasDistributionEntry> distribution(List<ProcessedCallNode> nodes, long totalGas) {
        Map<String, long[]> totals = new LinkedHashMap<>();
        for (ProcessedCallNode node : nodes) {
            long[] acc = totals.computeIfAbsent(distributionCategory(node), k -> new long[2]);
            acc[0] += node.gasUsed();
            acc[1]++;
        }
        return totals.entrySet().stream()
                .map(e -> new GasDistributionEntry(e.getKey(), e.getValue()[0], (int) e.getValue()[1],
                        Percentages.of(e.getValue()[0], totalGas)))
                .sorted(Comparator.comparingLong(GasDistributionEntry::gasUsed).reversed())
                .toList();
    }

    static String distributionCategory(ProcessedCallNode node) {
        if (!node.tracked()) {
            return DIST_EXTERNAL;
        }
        String name = Objects.requireNonNullElse(node.contractName(), "");
        if (name.contains("Token")) {
            return DIST_TOKEN;
        }
        if (name.contains("Supply")) {
            return DIST_SUPPLY;
        }
        return DIST_OTHER_TRACKED;
    }

    List<GasBreakdownEntry> breakdown(List<ProcessedCallNode> nodes, long totalGas) {
        Map<FunctionCategory, Long> byCategory = new EnumMap<>(FunctionCategory.class);
        for (ProcessedCallNode node : nodes) {
            FunctionCategory category = node.category() != null ? node.category() : FunctionCategory.OTHER;
            byCategory.merge(category, node.gasUsed(), Long::sum);
        }
        return byCategory.entrySet().stream()
                .map(e -> new GasBreakdownEntry(e.getKey(), e.getValue(), Percentages.of(e.getValue(), totalGas)))
                .sorted(Comparator.comparingLong(GasBreakdownEntry::gasUsed).reversed())
                .toList();
    }

    List<EfficiencyMetric> efficiencyMetrics(List<ProcessedCallNode> nodes, long totalGas) {
        List<EfficiencyMetric> metrics = new ArrayList<>();
        double avgGas = (double) totalGas / nodes.size();
        metrics.add(new EfficiencyMetric("Average Gas per Call", Math.round(avgGas), "gas",
                avgGas < 50_000 ? 90 : avgGas < 100_000 ? 70 : avgGas < 200_000 ? 50 : 30,
                "Average gas consumption per function call"));

        List<ProcessedCallNode> tracked = nodes.stream().filter(ProcessedCallNode::tracked).toList();
        if (!tracked.isEmpty()) {
            double trackedAvg = (double) tracked.stream().mapToLong(ProcessedCallNode::gasUsed).sum() / tracked.size();
            metrics.add(new EfficiencyMetric("PYUSD Operations Efficiency", Math.round(trackedAvg), "gas",
                    trackedAvg < 70_000 ? 90 : trackedAvg < 100_000 ? 70 : trackedAvg < 150_000 ? 50 : 30,
                    "Average gas for PYUSD-specific operations"));
        }

        long errors = nodes.stream().filter(ProcessedCallNode::hasError).count();
        double errorRate = Percentages.of(errors, nodes.size());
        metrics.add(new EfficiencyMetric("Success Rate", Math.round(100 - errorRate), "%",
                errorRate < 5 ? 95 : errorRate < 10 ? 80 : errorRate < 20 ? 60 : 30,
                "Percentage of successful operations"));

        int maxDepth = maxDepth(nodes);
        metrics.add(new EfficiencyMetric("Call Depth Complexity", maxDepth, "levels",
                maxDepth < 3 ? 90 : maxDepth < 5 ? 70 : maxDepth < 8 ? 50 : 30,
                "Maximum call stack depth reached"));
        return metrics;
    }

    List<OptimizationSuggestion> suggestions(List<ProcessedCallNode> nodes, long totalGas) {
        List<OptimizationSuggestion> suggestions = new ArrayList<>();

        List<ProcessedCallNode> transfers = withFunction(nodes, KnownFunctions.TRANSFER);
        if (transfers.size() >= BATCH_TRANSFER_MIN) {
            long transferGas = transfers.stream().mapToLong(ProcessedCallNode::gasUsed).sum();
            suggestions.add(new OptimizationSuggestion("batch_transfers", SuggestionType.GAS, RiskLevel.MEDIUM,
                    "Batch Multiple Transfers",
                    transfers.size() + " individual transfers detected",
                    "Consider using a multicall or batch transfer function to reduce gas costs",
                    Math.round(transferGas * 0.3), 30.0));
        }

        List<ProcessedCallNode> approvals = withFunction(nodes, KnownFunctions.APPROVE);
        boolean approvalUsed = nodes.stream()
                .filter(n -> n.functionNameContains("transferFrom"))
                .anyMatch(n -> approvals.stream().anyMatch(a -> n.from().equalsIgnoreCase(
                        Objects.requireNonNullElse(a.parameters().spender(), ""))));
        if (!approvals.isEmpty() && !approvalUsed) {
            suggestions.add(new OptimizationSuggestion("unused_approvals", SuggestionType.GAS, RiskLevel.LOW,
                    "Unused Approvals Detected",
                    "Approvals granted but no subsequent transfers found",
                    "Only approve tokens when immediately needed to save gas",
                    0L, 0.0));
        }

        List<ProcessedCallNode> failed = nodes.stream().filter(ProcessedCallNode::hasError).toList();
        if (!failed.isEmpty()) {
            long wasted = failed.stream().mapToLong(ProcessedCallNode::gasUsed).sum();
            suggestions.add(new OptimizationSuggestion("failed_operations", SuggestionType.PERFORMANCE, RiskLevel.HIGH,
                    "Failed Operations Detected",
                    failed.size() + " operations failed, wasting gas",
                    "Add proper validation and error handling to prevent failed transactions",
                    wasted, Percentages.of(wasted, totalGas)));
        }

        long highGasOps = nodes.stream().filter(n -> n.gasUsed() > GasThresholds.HIGH_SINGLE_CALL).count();
        if (highGasOps > 0) {
            suggestions.add(new OptimizationSuggestion("high_gas_operations", SuggestionType.GAS, RiskLevel.MEDIUM,
                    "High Gas Operations",
                    highGasOps + " operations used >200k gas each",
                    "Review high-gas operations for optimization opportunities",
                    0L, 0.0));
        }

        int maxDepth = maxDepth(nodes);
        if (maxDepth > DEEP_STACK) {
            suggestions.add(new OptimizationSuggestion("deep_call_stack", SuggestionType.PERFORMANCE, RiskLevel.MEDIUM,
                    "Deep Call Stack",
                    "Maximum call depth of " + maxDepth + " levels detected",
                    "Consider flattening call hierarchy to reduce gas overhead",
                    0L, 0.0));
        }

        GasUsageCategory category = GasThresholds.categorize(totalGas);
        if (category == GasUsageCategory.HIGH || category == GasUsageCategory.VERY_HIGH) {
            suggestions.add(new OptimizationSuggestion("high_total_gas", SuggestionType.GAS,
                    category == GasUsageCategory.VERY_HIGH ? RiskLevel.HIGH : RiskLevel.MEDIUM,
                    "High Total Gas Usage",
                    "Transaction consumed " + TokenAmounts.format(totalGas) + " gas",
                    "Split the operation or remove redundant contract calls",
                    0L, 0.0));
        }

        if (nodes.size() > MANY_CALLS) {
            suggestions.add(new OptimizationSuggestion("many_calls", SuggestionType.PERFORMANCE, RiskLevel.LOW,
                    "Many Internal Calls",
                    nodes.size() + " calls executed in one transaction",
                    "Cache repeated reads and avoid redundant external calls",
                    0L, 0.0));
        }
        return suggestions;
    }

    /**
     * Benchmarked tracked functions, sorted by absolute deviation from the median, largest first.
     */
    List<BenchmarkComparison> benchmarkComparisons(List<ProcessedCallNode> nodes) {
        Map<String, List<ProcessedCallNode>> grouped = nodes.stream()
                .filter(ProcessedCallNode::tracked)
                .filter(n -> GasBenchmarkTable.lookup(n.functionName()).isPresent())
                .collect(Collectors.groupingBy(ProcessedCallNode::functionName, LinkedHashMap::new, Collectors.toList()));
        List<BenchmarkComparison> comparisons = new ArrayList<>();
        grouped.forEach((functionName, calls) -> {
            GasBenchmark benchmark = GasBenchmarkTable.lookup(functionName).orElseThrow();
            double actual = calls.stream().mapToLong(ProcessedCallNode::gasUsed).average().orElse(0);
            double difference = actual - benchmark.median();
            comparisons.add(new BenchmarkComparison(
                    functionName,
                    Math.round(actual),
                    benchmark.median(),
                    benchmark.grade(Math.round(actual)),
                    Math.round(difference),
                    Percentages.round2(Percentages.of(difference, benchmark.median()))));
        });
        comparisons.sort(Comparator.comparingDouble((BenchmarkComparison c) -> Math.abs(c.percentageDiff())).reversed());
        return comparisons;
    }

    private static List<ProcessedCallNode> withFunction(List<ProcessedCallNode> nodes, String functionName) {
        return nodes.stream().filter(n -> functionName.equals(n.functionName())).toList();
    }

    private static int maxDepth(List<ProcessedCallNode> nodes) {
        return nodes.stream().mapToInt(ProcessedCallNode::depth).max().orElse(0);
    }
}
