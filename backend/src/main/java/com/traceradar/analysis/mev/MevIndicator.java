package com.traceradar.analysis.mev;

import com.traceradar.domain.RiskLevel;

import java.util.Map;

/**
 * One triggered MEV heuristic with the values that triggered it.
 */
public record MevIndicator(String type, double confidence, String description, RiskLevel severity, Map<String, Object> evidence) {

    public MevIndicator {
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }
}
