package com.traceradar.analysis.cache;

import com.traceradar.analysis.TraceAnalysisResult;

import java.time.Instant;

public record CachedAnalysis(TraceAnalysisResult result, Instant createdAt) {
}
