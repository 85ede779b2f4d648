package com.traceradar.analysis.gas;

import com.traceradar.domain.RiskLevel;

/**
 * Gas optimisation hint. Potential savings are zero when not estimated.
 */
public record OptimizationSuggestion(
        String id,
        SuggestionType type,
        RiskLevel severity,
        String title,
        String description,
        String recommendation,
        long potentialSavingsGas,
        double potentialSavingsPercentage
) {
}
