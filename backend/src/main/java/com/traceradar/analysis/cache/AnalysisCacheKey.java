package com.traceradar.analysis.cache;

import com.traceradar.analysis.AnalysisOptions;

import java.util.Locale;

/**
 * Transaction hash (lower-cased) plus the full option set.
 */
public record AnalysisCacheKey(String txHash, AnalysisOptions options) {

    public AnalysisCacheKey {
        txHash = txHash == null ? null : txHash.toLowerCase(Locale.ROOT);
    }
}
