package com.traceradar.analysis.compare;

import com.traceradar.common.Percentages;

/**
 * One metric of both transactions. {@code percentageChange} is never NaN or infinite.
 */
public record MetricDelta(long baseline, long target, long difference, double percentageChange) {

    public static MetricDelta of(long baseline, long target) {
        return new MetricDelta(baseline, target, target - baseline, Percentages.change(baseline, target));
    }
}
