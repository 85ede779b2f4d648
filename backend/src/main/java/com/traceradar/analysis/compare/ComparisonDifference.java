package com.traceradar.analysis.compare;

import com.traceradar.domain.RiskLevel;

/**
 * One categorical difference between two analyses.
 *
 * @param type          stable identifier, e.g. {@code gas_usage_change}
 * @param baselineValue display value for the first transaction, "N/A" when not applicable
 */
public record ComparisonDifference(
        DifferenceCategory category,
        String type,
        String description,
        RiskLevel impact,
        String baselineValue,
        String targetValue
) {
}
