package com.traceradar.analysis.security;

import com.traceradar.domain.RiskLevel;

/**
 * A call scored high or critical by {@link CallRiskAssessor}. {@code description} joins the scoring factors.
 */
public record HighRiskOperation(String functionName, RiskLevel level, String description, String contract, String caller) {
}
