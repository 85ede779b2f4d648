package com.traceradar.analysis.compare;

import com.traceradar.analysis.pattern.PatternType;
import com.traceradar.domain.RiskLevel;

public record TransactionSnapshot(
        String transactionHash,
        PatternType pattern,
        long gasUsed,
        int actionCount,
        int contractCount,
        RiskLevel overallRisk,
        int securityRiskScore,
        boolean hasErrors
) {
}
