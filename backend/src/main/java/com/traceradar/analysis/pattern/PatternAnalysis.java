package com.traceradar.analysis.pattern;

import java.util.List;

/**
 * Output of the pattern stage: ranked classification, complexity and insights.
 */
public record PatternAnalysis(TransactionPattern pattern, ComplexityAnalysis complexity, PatternInsights insights) {

    public static PatternAnalysis of(TransactionPattern pattern, ComplexityAnalysis complexity) {
        return new PatternAnalysis(pattern, complexity, PatternInsights.forPattern(pattern.type()));
    }

    /** Placeholder used when pattern detection is switched off; complexity is still reported. */
    public static PatternAnalysis disabled(ComplexityAnalysis complexity) {
        TransactionPattern none = new TransactionPattern(
                new PatternMatch(PatternType.UNKNOWN, 0.0, "Pattern analysis disabled"), List.of());
        return new PatternAnalysis(none, complexity, PatternInsights.forPattern(PatternType.UNKNOWN));
    }
}
