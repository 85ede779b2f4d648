package com.traceradar.analysis.mev;

import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class LiquidationMevDetector implements MevPatternDetector {

    private static final BigDecimal VALUE_SHARE = new BigDecimal("0.15");

    @Override
    public MevPatternType type() {
        return MevPatternType.LIQUIDATION_MEV;
    }

    @Override
    public MevDetection detect(MevContext context) {
        List<ProcessedCallNode> liquidations = context.nodes().stream().filter(CallHeuristics::isLiquidation).toList();
        if (liquidations.isEmpty()) {
            return MevDetection.none(type());
        }

        List<MevIndicator> indicators = new ArrayList<>();
        indicators.add(new MevIndicator("liquidation_bonus", 0.8, "Liquidation bonus extraction detected",
                RiskLevel.MEDIUM, Map.of("liquidationCalls", liquidations.size())));

        boolean flashLoan = context.nodes().stream().anyMatch(n -> n.functionNameLower().contains("flashloan"));
        boolean liquidate = context.nodes().stream().anyMatch(n -> n.functionNameLower().contains("liquidate"));
        if (flashLoan && liquidate) {
            indicators.add(new MevIndicator("flash_loan_liquidation", 0.9, "Flash loan liquidation strategy detected",
                    RiskLevel.HIGH, Map.of("hasFlashLoan", true, "hasLiquidation", true)));
        }

        MevPattern pattern = new MevPattern(type(), CallHeuristics.meanConfidence(indicators), RiskLevel.MEDIUM,
                "Liquidation MEV extraction detected", indicators,
                CallHeuristics.sumValue(liquidations).multiply(VALUE_SHARE));
        return new MevDetection(type(), indicators, pattern);
    }
}
