package com.traceradar.analysis.pattern;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Declarative classification rule: a fixed confidence emitted when the condition holds.
 */
public record PatternRule(PatternType type, double confidence, String description, Predicate<PatternFeatures> condition) {

    public Optional<PatternMatch> evaluate(PatternFeatures features) {
        if (!condition.test(features)) {
            return Optional.empty();
        }
        return Optional.of(new PatternMatch(type, confidence, description));
    }
}
