package com.traceradar.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.traceradar.analysis.cache.AnalysisCache;
import com.traceradar.analysis.cache.AnalysisCacheKey;
import com.traceradar.analysis.cache.AnalysisCacheStats;
import com.traceradar.analysis.cache.CachedAnalysis;
import com.traceradar.analysis.compare.ComparativeAnalyzer;
import com.traceradar.analysis.compare.ComparisonResult;
import com.traceradar.analysis.visualization.CallTreeView;
import com.traceradar.common.TransactionHashes;
import com.traceradar.ingestion.adapter.TraceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for trace analysis: validates the hash, fetches the trace once, runs the pipeline and caches the
 * result per (transaction, options). The cache is only touched here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TraceAnalysisService {

    private final TraceProvider traceProvider;
    private final TraceAnalysisPipeline pipeline;
    private final AnalysisCache cache;
    private final ComparativeAnalyzer comparativeAnalyzer;

    public TraceAnalysisResult analyze(String txHash, AnalysisOptions options) {
        requireValidHash(txHash);
        AnalysisOptions effective = options == null ? AnalysisOptions.defaults() : options;
        AnalysisCacheKey key = new AnalysisCacheKey(txHash, effective);
        return cache.getOrCompute(key, () -> computeAnalysis(key.txHash(), effective));
    }

    public Optional<TraceAnalysisResult> getCachedResult(String txHash, AnalysisOptions options) {
        requireValidHash(txHash);
        return cache.get(new AnalysisCacheKey(txHash, options)).map(CachedAnalysis::result);
    }

    /**
     * Diffs two analyses already cached with default options. Does not trigger analysis.
     *
     * @throws AnalysisNotAvailableException when either analysis is missing or expired
     */
    public ComparisonResult compare(String baseTxHash, String targetTxHash) {
        TraceAnalysisResult base = getCachedResult(baseTxHash, AnalysisOptions.defaults())
                .orElseThrow(() -> new AnalysisNotAvailableException(baseTxHash));
        TraceAnalysisResult target = getCachedResult(targetTxHash, AnalysisOptions.defaults())
                .orElseThrow(() -> new AnalysisNotAvailableException(targetTxHash));
        return comparativeAnalyzer.compare(base, target);
    }

    public CallTreeView callTree(String txHash) {
        return CallTreeView.of(analyze(txHash, AnalysisOptions.defaults()).processedNodes());
    }

    public AnalysisCacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
    }

    private TraceAnalysisResult computeAnalysis(String txHash, AnalysisOptions options) {
        log.info("Analyzing trace of {} with {}", txHash, options);
        List<JsonNode> items = traceProvider.fetchTrace(txHash);
        TraceAnalysisResult result = pipeline.run(txHash, items, options);
        if (result.skippedRecords() > 0) {
            log.warn("Trace of {}: {} malformed records skipped", txHash, result.skippedRecords());
        }
        log.info("Analysis of {} finished: calls={}, pattern={}, risk={}", txHash, result.summary().totalCalls(),
                result.patternAnalysis().pattern().type().label(), result.securityAssessment().overallRisk());
        return result;
    }

    private static void requireValidHash(String txHash) {
        if (!TransactionHashes.isValid(txHash)) {
            throw new InvalidTransactionHashException(txHash);
        }
    }
}
