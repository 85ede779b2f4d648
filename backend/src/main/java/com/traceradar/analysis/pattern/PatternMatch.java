package com.traceradar.analysis.pattern;

/**
 * One triggered pattern rule.
 */
public record PatternMatch(PatternType type, double confidence, String description) {

    static PatternMatch unknown() {
        return new PatternMatch(PatternType.UNKNOWN, 0.0, "Unknown transaction pattern");
    }
}
