package com.traceradar.analysis.security;

import com.traceradar.domain.RiskLevel;

import java.util.List;

public record RiskAssessment(RiskLevel level, int score, List<String> factors, List<String> recommendations) {

    public RiskAssessment {
        factors = List.copyOf(factors);
        recommendations = List.copyOf(recommendations);
    }
}
