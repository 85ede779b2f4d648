package com.traceradar.analysis;

/**
 * Stage switches of one analysis. Part of the cache key, so two requests share a cached result only when every
 * switch matches.
 */
public record AnalysisOptions(
        boolean patternDetection,
        boolean mevDetection,
        boolean securityAnalysis,
        boolean visualization,
        AnalysisDepth depth
) {

    private static final AnalysisOptions DEFAULTS = new AnalysisOptions(true, true, true, true, AnalysisDepth.FULL);

    public AnalysisOptions {
        depth = depth == null ? AnalysisDepth.FULL : depth;
    }

    public static AnalysisOptions defaults() {
        return DEFAULTS;
    }

    public boolean advancedMev() {
        return mevDetection && depth == AnalysisDepth.FULL;
    }
}
