package com.traceradar.analysis.mev;

import com.traceradar.domain.GasThresholds;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cheap single-pass MEV screen. The highest-confidence indicator becomes the finding; ties keep declaration order.
 */
@Component
public class BasicMevDetector {

    private static final int SANDWICH_MIN_EXTERNAL_CALLS = 3;
    private static final int ARBITRAGE_MIN_MOVEMENTS = 3;
    private static final int ARBITRAGE_MIN_CONTRACTS = 3;
    private static final int COMPLEX_MIN_CALLS = 20;
    private static final int COMPLEX_MIN_CONTRACTS = 5;

    public MevAnalysis detect(List<ProcessedCallNode> nodes) {
        if (nodes.isEmpty()) {
            return MevAnalysis.none();
        }

        long tokenMovements = nodes.stream()
                .filter(n -> n.functionNameContains("transfer") || n.functionNameContains("swap"))
                .count();
        long uniqueContracts = nodes.stream().map(ProcessedCallNode::to).filter(Objects::nonNull).distinct().count();
        boolean hasSwap = nodes.stream().anyMatch(n -> n.functionNameLower().contains("swap"));
        long externalCalls = nodes.stream().filter(n -> !n.tracked()).count();
        long totalGas = nodes.stream().mapToLong(ProcessedCallNode::gasUsed).sum();

        List<MevIndicator> indicators = new ArrayList<>();
        if (hasSwap && externalCalls > SANDWICH_MIN_EXTERNAL_CALLS) {
            indicators.add(new MevIndicator("potential_sandwich_target", 0.6,
                    "Transaction contains swap with external calls", RiskLevel.MEDIUM,
                    Map.of("externalCalls", externalCalls)));
        }
        if (tokenMovements >= ARBITRAGE_MIN_MOVEMENTS && uniqueContracts >= ARBITRAGE_MIN_CONTRACTS) {
            indicators.add(new MevIndicator("potential_arbitrage", 0.7,
                    "Multiple token movements across different contracts", RiskLevel.MEDIUM,
                    Map.of("tokenMovements", tokenMovements, "uniqueContracts", uniqueContracts)));
        }
        if (nodes.size() > COMPLEX_MIN_CALLS && uniqueContracts > COMPLEX_MIN_CONTRACTS) {
            indicators.add(new MevIndicator("complex_operation", 0.5,
                    "Complex multi-step operation with many contracts", RiskLevel.LOW,
                    Map.of("calls", nodes.size(), "uniqueContracts", uniqueContracts)));
        }
        if (totalGas > GasThresholds.VERY_HIGH) {
            indicators.add(new MevIndicator("high_gas_usage", 0.4,
                    "High gas usage potentially indicating MEV activity", RiskLevel.LOW,
                    Map.of("totalGas", totalGas)));
        }

        if (indicators.isEmpty()) {
            return MevAnalysis.none();
        }
        // List.sort is stable, so equal confidences keep declaration order.
        indicators.sort(Comparator.comparingDouble(MevIndicator::confidence).reversed());
        MevIndicator best = indicators.get(0);
        return new MevAnalysis(true, best.type(), best.confidence(), best.description(), indicators);
    }
}
