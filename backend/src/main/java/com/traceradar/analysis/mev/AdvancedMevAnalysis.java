package com.traceradar.analysis.mev;

import com.traceradar.domain.RiskLevel;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregate of the advanced detectors. {@code indicators} holds only the indicators of detectors whose pattern fired;
 * {@code detections} keeps every detector's own result.
 */
public record AdvancedMevAnalysis(
        boolean mevDetected,
        double score,
        RiskLevel riskLevel,
        List<MevIndicator> indicators,
        List<MevPattern> patterns,
        BigDecimal totalExtractedValue,
        List<MevDetection> detections,
        List<String> recommendations
) {

    public AdvancedMevAnalysis {
        indicators = List.copyOf(indicators);
        patterns = List.copyOf(patterns);
        detections = List.copyOf(detections);
        recommendations = List.copyOf(recommendations);
    }

    public static AdvancedMevAnalysis none() {
        return new AdvancedMevAnalysis(false, 0.0, RiskLevel.LOW, List.of(), List.of(), BigDecimal.ZERO, List.of(),
                List.of());
    }
}
