package com.traceradar.analysis.compare;

import com.traceradar.analysis.security.SecurityConcern;

import java.util.List;

/**
 * Concern-level diff. Risk scores weight concerns low 1, medium 3, high 5, critical 10; concerns match on level and
 * description.
 */
public record SecurityComparison(
        int riskScoreChange,
        int concernCountChange,
        List<SecurityConcern> newConcerns,
        List<SecurityConcern> resolvedConcerns,
        String summary
) {

    public SecurityComparison {
        newConcerns = List.copyOf(newConcerns);
        resolvedConcerns = List.copyOf(resolvedConcerns);
    }
}
