package com.traceradar.analysis.compare;

public record ComparisonMetrics(
        MetricDelta actionCount,
        MetricDelta gasUsage,
        MetricDelta contractCount,
        MetricDelta maxDepth,
        MetricDelta errorCount
) {
}
