package com.traceradar.analysis.security;

import com.traceradar.domain.RiskLevel;

import java.util.List;

/**
 * Security view of one trace. Concerns and high-risk operations are computed independently and are not
 * deduplicated against each other, so their counts can differ.
 */
public record SecurityAssessment(
        RiskLevel overallRisk,
        List<SecurityConcern> concerns,
        List<HighRiskOperation> highRiskOperations,
        List<SecurityRecommendation> recommendations,
        List<ApprovalRisk> approvalRisks
) {

    public SecurityAssessment {
        concerns = List.copyOf(concerns);
        highRiskOperations = List.copyOf(highRiskOperations);
        recommendations = List.copyOf(recommendations);
        approvalRisks = List.copyOf(approvalRisks);
    }

    public static SecurityAssessment empty() {
        return new SecurityAssessment(RiskLevel.LOW, List.of(), List.of(), List.of(), List.of());
    }
}
