package com.traceradar.analysis.cache;

import java.util.List;

public record AnalysisCacheStats(long size, List<AnalysisCacheKey> keys) {

    public AnalysisCacheStats {
        keys = List.copyOf(keys);
    }
}
