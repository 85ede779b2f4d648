package com.traceradar.analysis.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.traceradar.analysis.TraceAnalysisResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Completed analyses keyed by (transaction, options) with a fixed write TTL and no size bound.
 * An expired entry reads as a miss and is replaced by the next store.
 * <p>
 * Entries are futures so an analysis in progress occupies its key without holding a map lock: the loader runs on
 * the calling thread after the key is claimed, and concurrent callers for the same key wait on the same future.
 */
@Slf4j
public class AnalysisCache {

    private final AsyncCache<AnalysisCacheKey, CachedAnalysis> cache;
    private final Clock clock;

    public AnalysisCache(Duration ttl, Ticker ticker, Clock clock) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .buildAsync();
        this.clock = clock;
    }

    /** Completed analysis for the key; an analysis still in progress reads as a miss. */
    public Optional<CachedAnalysis> get(AnalysisCacheKey key) {
        CompletableFuture<CachedAnalysis> future = cache.getIfPresent(key);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    public void put(AnalysisCacheKey key, TraceAnalysisResult result) {
        cache.put(key, CompletableFuture.completedFuture(new CachedAnalysis(result, Instant.now(clock))));
    }

    /**
     * Returns the cached analysis or computes and stores it. Concurrent callers for one key wait for a single
     * computation; an exception from {@code loader} propagates to every waiting caller and nothing is stored.
     */
    public TraceAnalysisResult getOrCompute(AnalysisCacheKey key, Supplier<TraceAnalysisResult> loader) {
        CompletableFuture<CachedAnalysis> claim = new CompletableFuture<>();
        CompletableFuture<CachedAnalysis> present = cache.asMap().putIfAbsent(key, claim);
        if (present != null) {
            log.debug("Analysis cache hit: {}", key.txHash());
            return await(present).result();
        }
        try {
            CachedAnalysis computed = new CachedAnalysis(loader.get(), Instant.now(clock));
            claim.complete(computed);
            return computed.result();
        } catch (RuntimeException | Error e) {
            cache.asMap().remove(key, claim);
            claim.completeExceptionally(e);
            throw e;
        }
    }

    public AnalysisCacheStats stats() {
        cache.synchronous().cleanUp();
        return new AnalysisCacheStats(cache.synchronous().estimatedSize(), new ArrayList<>(cache.asMap().keySet()));
    }

    public void clear() {
        cache.synchronous().invalidateAll();
        log.info("Analysis cache cleared");
    }

    private static CachedAnalysis await(CompletableFuture<CachedAnalysis> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
