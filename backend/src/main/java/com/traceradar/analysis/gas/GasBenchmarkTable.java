package com.traceradar.analysis.gas;

import com.traceradar.common.Percentages;
import com.traceradar.domain.KnownFunctions;

import java.util.Map;
import java.util.Optional;

/**
 * Static gas benchmarks for the tracked token functions.
 */
public final class GasBenchmarkTable {

    static final Map<String, GasBenchmark> BENCHMARKS = Map.of(
            KnownFunctions.TRANSFER, new GasBenchmark(KnownFunctions.TRANSFER, 52_000, 65_000, 78_000),
            KnownFunctions.APPROVE, new GasBenchmark(KnownFunctions.APPROVE, 42_000, 46_000, 58_000),
            KnownFunctions.TRANSFER_FROM, new GasBenchmark(KnownFunctions.TRANSFER_FROM, 65_000, 75_000, 90_000),
            KnownFunctions.MINT, new GasBenchmark(KnownFunctions.MINT, 95_000, 110_000, 130_000),
            KnownFunctions.BURN, new GasBenchmark(KnownFunctions.BURN, 80_000, 90_000, 105_000)
    );

    private GasBenchmarkTable() {
    }

    public static Optional<GasBenchmark> lookup(String functionName) {
        if (functionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BENCHMARKS.get(functionName));
    }

    /**
     * Grades a single gas amount; UNKNOWN when the function has no benchmark.
     */
    public static GasEfficiency grade(long gasUsed, String functionName) {
        return lookup(functionName)
                .map(b -> new GasEfficiency(b.grade(gasUsed), Percentages.of(gasUsed - b.median(), b.median()), gasUsed - b.median()))
                .orElse(GasEfficiency.UNKNOWN);
    }
}
