package com.traceradar.analysis.compare;

import java.util.List;

/**
 * Diff of two completed analyses; {@code baseline} is the first transaction, {@code target} the second.
 */
public record ComparisonResult(
        TransactionSnapshot baseline,
        TransactionSnapshot target,
        ComparisonMetrics metrics,
        List<ComparisonDifference> differences,
        PatternComparison patternComparison,
        GasComparison gasComparison,
        SecurityComparison securityComparison,
        List<String> recommendations
) {

    public ComparisonResult {
        differences = List.copyOf(differences);
        recommendations = List.copyOf(recommendations);
    }
}
