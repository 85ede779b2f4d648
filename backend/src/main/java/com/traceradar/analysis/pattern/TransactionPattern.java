package com.traceradar.analysis.pattern;

import java.util.List;

/**
 * Primary pattern and every triggered match, ranked by non-increasing confidence.
 */
public record TransactionPattern(PatternMatch primary, List<PatternMatch> matches) {

    public TransactionPattern {
        matches = List.copyOf(matches);
    }

    public PatternType type() {
        return primary.type();
    }

    public double confidence() {
        return primary.confidence();
    }

    static TransactionPattern unknown() {
        return new TransactionPattern(PatternMatch.unknown(), List.of());
    }
}
