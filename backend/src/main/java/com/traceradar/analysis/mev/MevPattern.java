package com.traceradar.analysis.mev;

import com.traceradar.domain.RiskLevel;

import java.math.BigDecimal;
import java.util.List;

/**
 * Composite MEV finding backed by corroborating indicators. Confidence is the mean of the indicator confidences;
 * extracted value is in native currency units.
 */
public record MevPattern(
        MevPatternType type,
        double confidence,
        RiskLevel severity,
        String description,
        List<MevIndicator> indicators,
        BigDecimal extractedValue
) {

    public MevPattern {
        indicators = List.copyOf(indicators);
    }
}
