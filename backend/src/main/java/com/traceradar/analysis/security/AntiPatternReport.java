package com.traceradar.analysis.security;

import com.traceradar.domain.RiskLevel;

import java.util.List;

/**
 * Findings of the ordering and ratio scan. Severity stays LOW unless a reentrancy or approval-ratio pattern fires.
 */
public record AntiPatternReport(List<String> patterns, RiskLevel severity, List<String> recommendations) {

    public AntiPatternReport {
        patterns = List.copyOf(patterns);
        recommendations = List.copyOf(recommendations);
    }

    public static AntiPatternReport none() {
        return new AntiPatternReport(List.of(), RiskLevel.LOW, List.of());
    }
}
