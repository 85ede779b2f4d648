package com.traceradar.analysis.mev;

import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cross-venue price exploitation: swaps against at least two distinct DEX targets.
 */
@Component
public class ArbitrageDetector implements MevPatternDetector {

    private static final int MIN_VENUES = 2;
    private static final int MIN_INDICATORS = 2;
    private static final int ATOMIC_MIN_CALLS = 10;
    private static final BigDecimal VALUE_SHARE = new BigDecimal("0.1");

    @Override
    public MevPatternType type() {
        return MevPatternType.ARBITRAGE;
    }

    @Override
    public MevDetection detect(MevContext context) {
        List<ProcessedCallNode> dexCalls = context.dexCalls();
        long venues = dexCalls.stream().map(ProcessedCallNode::to).filter(Objects::nonNull).distinct().count();
        if (venues < MIN_VENUES) {
            return MevDetection.none(type());
        }

        List<MevIndicator> indicators = new ArrayList<>();
        indicators.add(new MevIndicator("price_discrepancy", 0.7,
                "Price discrepancy exploitation across multiple DEXes", RiskLevel.MEDIUM,
                Map.of("dexCount", venues, "interactions", dexCalls.size())));

        long flashLoanCalls = context.nodes().stream().filter(CallHeuristics::isFlashLoan).count();
        if (flashLoanCalls > 0) {
            indicators.add(new MevIndicator("flash_loan_usage", 0.8,
                    "Flash loan usage detected for capital efficiency", RiskLevel.MEDIUM,
                    Map.of("flashLoanCalls", flashLoanCalls)));
        }

        boolean reverted = context.nodes().stream().anyMatch(ProcessedCallNode::hasError);
        if (!reverted && context.nodes().size() > ATOMIC_MIN_CALLS) {
            indicators.add(new MevIndicator("atomic_execution", 0.6,
                    "Atomic execution pattern suggesting MEV strategy", RiskLevel.LOW,
                    Map.of("traceCount", context.nodes().size(), "noReverts", true)));
        }

        if (indicators.size() < MIN_INDICATORS) {
            return new MevDetection(type(), indicators, null);
        }
        MevPattern pattern = new MevPattern(type(), CallHeuristics.meanConfidence(indicators), RiskLevel.MEDIUM,
                "Arbitrage opportunity exploitation detected", indicators,
                CallHeuristics.sumValue(dexCalls).multiply(VALUE_SHARE));
        return new MevDetection(type(), indicators, pattern);
    }
}
