package com.traceradar.analysis.mev;

import com.traceradar.domain.ProcessedCallNode;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Name-based call shape heuristics used by the MEV detectors.
 */
final class CallHeuristics {

    static final List<String> DEX_KEYWORDS = List.of("swap", "exchange", "trade", "uniswap", "sushiswap", "curve", "balancer");
    static final List<String> FLASH_LOAN_KEYWORDS = List.of("flashloan", "borrow", "repay");
    static final List<String> LIQUIDATION_KEYWORDS = List.of("liquidate", "seize", "repay");

    private CallHeuristics() {
    }

    static boolean isDexShaped(ProcessedCallNode node) {
        return containsAny(node.functionName(), DEX_KEYWORDS) || containsAny(node.contractName(), DEX_KEYWORDS);
    }

    static boolean isFlashLoan(ProcessedCallNode node) {
        return containsAny(node.functionName(), FLASH_LOAN_KEYWORDS);
    }

    static boolean isLiquidation(ProcessedCallNode node) {
        return containsAny(node.functionName(), LIQUIDATION_KEYWORDS);
    }

    static BigDecimal sumValue(Collection<ProcessedCallNode> nodes) {
        return nodes.stream()
                .map(ProcessedCallNode::valueNative)
                .filter(v -> v != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    static double meanConfidence(List<MevIndicator> indicators) {
        return indicators.stream().mapToDouble(MevIndicator::confidence).average().orElse(0.0);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }
}
