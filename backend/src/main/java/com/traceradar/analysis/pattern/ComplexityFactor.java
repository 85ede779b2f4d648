package com.traceradar.analysis.pattern;

/**
 * One weighted term of the complexity score. {@code contribution} is already capped; the score adds
 * {@code contribution * weight}.
 */
public record ComplexityFactor(String name, double value, double weight, double contribution) {

    public double weighted() {
        return contribution * weight;
    }
}
