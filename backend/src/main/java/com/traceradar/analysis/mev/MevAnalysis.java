package com.traceradar.analysis.mev;

import java.util.List;

/**
 * Basic-tier MEV finding: the highest-confidence indicator, if any.
 */
public record MevAnalysis(boolean detected, String type, double confidence, String description, List<MevIndicator> indicators) {

    public MevAnalysis {
        indicators = List.copyOf(indicators);
    }

    public static MevAnalysis none() {
        return new MevAnalysis(false, null, 0.0, null, List.of());
    }
}
