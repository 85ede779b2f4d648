package com.traceradar.analysis.mev;

import com.traceradar.domain.GasThresholds;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Front-and-back swaps around a victim: deep call stack with several DEX calls.
 */
@Component
public class SandwichDetector implements MevPatternDetector {

    private static final int MIN_DEPTH = 3;
    private static final BigDecimal HIGH_VALUE_SWAP = BigDecimal.TEN;
    private static final int MIN_INDICATORS = 2;

    @Override
    public MevPatternType type() {
        return MevPatternType.SANDWICH_ATTACK;
    }

    @Override
    public MevDetection detect(MevContext context) {
        List<ProcessedCallNode> dexCalls = context.dexCalls();
        if (context.maxDepth() <= MIN_DEPTH || dexCalls.size() <= 1) {
            return MevDetection.none(type());
        }

        List<MevIndicator> indicators = new ArrayList<>();
        List<ProcessedCallNode> highValue = dexCalls.stream()
                .filter(n -> n.valueNative() != null && n.valueNative().compareTo(HIGH_VALUE_SWAP) > 0)
                .toList();
        if (!highValue.isEmpty()) {
            indicators.add(new MevIndicator("high_price_impact", 0.8,
                    "High value swaps detected indicating potential price manipulation", RiskLevel.HIGH,
                    Map.of("swapCount", highValue.size(), "totalValue", CallHeuristics.sumValue(highValue))));
        }
        if (dexCalls.size() > 2) {
            indicators.add(new MevIndicator("unusual_slippage", 0.6,
                    "Multiple DEX interactions suggesting slippage exploitation", RiskLevel.MEDIUM,
                    Map.of("interactionCount", dexCalls.size())));
        }
        long deepCalls = context.nodes().stream().filter(n -> n.depth() > MIN_DEPTH).count();
        long cheapCalls = context.nodes().stream().filter(n -> n.gasUsed() < GasThresholds.BASE_TRANSACTION).count();
        if (deepCalls > 5 && cheapCalls > 0) {
            indicators.add(new MevIndicator("mev_bot_signature", 0.9,
                    "MEV bot signature detected in transaction pattern", RiskLevel.HIGH,
                    Map.of("complexInteractions", deepCalls, "gasOptimizations", cheapCalls)));
        }

        if (indicators.size() < MIN_INDICATORS) {
            return new MevDetection(type(), indicators, null);
        }
        MevPattern pattern = new MevPattern(type(), CallHeuristics.meanConfidence(indicators), RiskLevel.HIGH,
                "Potential sandwich attack detected", indicators, CallHeuristics.sumValue(dexCalls));
        return new MevDetection(type(), indicators, pattern);
    }
}
