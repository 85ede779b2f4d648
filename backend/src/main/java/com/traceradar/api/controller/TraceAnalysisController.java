package com.traceradar.api.controller;

import com.traceradar.analysis.AnalysisDepth;
import com.traceradar.analysis.AnalysisOptions;
import com.traceradar.analysis.TraceAnalysisResult;
import com.traceradar.analysis.TraceAnalysisService;
import com.traceradar.analysis.cache.AnalysisCacheStats;
import com.traceradar.analysis.compare.ComparisonResult;
import com.traceradar.analysis.visualization.CallTreeView;
import com.traceradar.api.dto.CompareRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * GET /traces/{txHash}, GET /traces/{txHash}/tree, GET /traces/compare, GET /traces/cache/stats, DELETE /traces/cache.
 * Analysis blocks on the trace fetch, so it runs on boundedElastic.
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class TraceAnalysisController {

    private final TraceAnalysisService traceAnalysisService;

    @GetMapping("/{txHash}")
    public Mono<ResponseEntity<TraceAnalysisResult>> analyze(
            @PathVariable String txHash,
            @RequestParam(defaultValue = "true") boolean pattern,
            @RequestParam(defaultValue = "true") boolean mev,
            @RequestParam(defaultValue = "true") boolean security,
            @RequestParam(defaultValue = "true") boolean visualization,
            @RequestParam(defaultValue = "FULL") AnalysisDepth depth) {
        AnalysisOptions options = new AnalysisOptions(pattern, mev, security, visualization, depth);
        return Mono.fromCallable(() -> traceAnalysisService.analyze(txHash, options))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{txHash}/tree")
    public Mono<ResponseEntity<CallTreeView>> callTree(@PathVariable String txHash) {
        return Mono.fromCallable(() -> traceAnalysisService.callTree(txHash))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/compare")
    public ResponseEntity<ComparisonResult> compare(@Valid @ModelAttribute CompareRequest request) {
        return ResponseEntity.ok(traceAnalysisService.compare(request.base(), request.target()));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<AnalysisCacheStats> cacheStats() {
        return ResponseEntity.ok(traceAnalysisService.cacheStats());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        traceAnalysisService.clearCache();
        return ResponseEntity.noContent().build();
    }
}
