package com.traceradar.analysis.mev;

import com.traceradar.analysis.gas.BenchmarkComparison;
import com.traceradar.domain.GasThresholds;
import com.traceradar.domain.RiskLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Gas-driven ordering: gas well over benchmark, a short gas-efficient bot shape, or elevated absolute gas.
 * A single indicator is enough.
 */
@Component
public class FrontRunningDetector implements MevPatternDetector {

    private static final double BENCHMARK_MULTIPLIER = 1.5;
    private static final int QUICK_EXECUTION_MAX_CALLS = 5;
    private static final BigDecimal VALUE_SHARE = new BigDecimal("0.05");

    @Override
    public MevPatternType type() {
        return MevPatternType.FRONT_RUNNING;
    }

    @Override
    public MevDetection detect(MevContext context) {
        List<MevIndicator> indicators = new ArrayList<>();
        long totalGas = context.gasAnalysis().totalGas();

        List<BenchmarkComparison> comparisons = context.gasAnalysis().benchmarkComparisons();
        if (!comparisons.isEmpty()) {
            long benchmarkGas = comparisons.get(0).benchmarkGas();
            if (totalGas > benchmarkGas * BENCHMARK_MULTIPLIER) {
                indicators.add(new MevIndicator("high_gas_price", 0.7,
                        "Unusually high gas price suggesting front-running", RiskLevel.MEDIUM,
                        Map.of("actualGas", totalGas, "benchmarkGas", benchmarkGas)));
            }
        }

        boolean quick = context.nodes().size() < QUICK_EXECUTION_MAX_CALLS;
        boolean gasEfficient = context.nodes().stream().allMatch(n -> n.gasUsed() > 0);
        if (quick && gasEfficient) {
            indicators.add(new MevIndicator("frontrun_bot_pattern", 0.7,
                    "Front-running bot execution pattern detected", RiskLevel.HIGH,
                    Map.of("quickExecution", true, "gasEfficient", true)));
        }

        if (totalGas > GasThresholds.MODERATE) {
            indicators.add(new MevIndicator("timing_pattern", 0.5,
                    "Timing pattern suggesting strategic execution", RiskLevel.LOW,
                    Map.of("gasUsed", totalGas)));
        }

        if (indicators.isEmpty()) {
            return MevDetection.none(type());
        }
        MevPattern pattern = new MevPattern(type(), CallHeuristics.meanConfidence(indicators), RiskLevel.HIGH,
                "Front-running pattern detected", indicators,
                CallHeuristics.sumValue(context.nodes()).multiply(VALUE_SHARE));
        return new MevDetection(type(), indicators, pattern);
    }
}
