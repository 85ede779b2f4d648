package com.traceradar.analysis.mev;

import java.util.List;

/**
 * Result of one advanced detector: the indicators it computed and the pattern, when enough of them fired.
 */
public record MevDetection(MevPatternType type, List<MevIndicator> indicators, MevPattern pattern) {

    public MevDetection {
        indicators = List.copyOf(indicators);
    }

    public static MevDetection none(MevPatternType type) {
        return new MevDetection(type, List.of(), null);
    }

    public boolean detected() {
        return pattern != null;
    }
}
