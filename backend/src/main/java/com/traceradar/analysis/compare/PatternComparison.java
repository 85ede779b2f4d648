package com.traceradar.analysis.compare;

/**
 * @param matchChanges pattern labels triggered in one transaction but not the other
 */
public record PatternComparison(
        boolean typeChanged,
        double confidenceChange,
        double complexityChange,
        ListDiff matchChanges,
        String summary
) {
}
