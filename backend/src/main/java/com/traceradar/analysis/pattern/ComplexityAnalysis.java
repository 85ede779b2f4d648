package com.traceradar.analysis.pattern;

import java.util.List;

public record ComplexityAnalysis(double score, ComplexityLevel level, List<ComplexityFactor> factors) {

    public ComplexityAnalysis {
        factors = List.copyOf(factors);
    }
}
