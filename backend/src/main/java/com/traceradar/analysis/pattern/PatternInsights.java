package com.traceradar.analysis.pattern;

import com.traceradar.domain.RiskLevel;

import java.util.List;
import java.util.Map;

/**
 * Human-readable reading of the primary pattern.
 */
public record PatternInsights(List<String> insights, List<String> recommendations, RiskLevel riskLevel) {

    public PatternInsights {
        insights = List.copyOf(insights);
        recommendations = List.copyOf(recommendations);
    }

    private static final Map<PatternType, PatternInsights> BY_TYPE = Map.of(
            PatternType.SIMPLE_TRANSFER, new PatternInsights(
                    List.of("This is a straightforward PYUSD transfer between two addresses",
                            "Low complexity transaction with minimal gas usage"),
                    List.of("Consider batching multiple transfers to save gas"),
                    RiskLevel.LOW),
            PatternType.SWAP_OPERATION, new PatternInsights(
                    List.of("This transaction involves swapping PYUSD through a DEX",
                            "Multiple contract interactions detected"),
                    List.of("Monitor slippage and MEV protection",
                            "Consider using MEV-protected transaction pools"),
                    RiskLevel.MEDIUM),
            PatternType.SUPPLY_CHANGE, new PatternInsights(
                    List.of("This transaction modifies PYUSD token supply",
                            "Administrative operation with high privilege requirements"),
                    List.of("Verify authorization and audit trail",
                            "Monitor for unusual supply changes"),
                    RiskLevel.HIGH),
            PatternType.MULTI_TRANSFER, new PatternInsights(
                    List.of("Multiple PYUSD transfers in a single transaction",
                            "Efficient gas usage through batching"),
                    List.of("Good practice for reducing transaction costs"),
                    RiskLevel.LOW)
    );

    private static final PatternInsights UNCLEAR = new PatternInsights(
            List.of("Transaction pattern not clearly identified"),
            List.of("Manual review recommended for complex transactions"),
            RiskLevel.MEDIUM);

    public static PatternInsights forPattern(PatternType type) {
        return BY_TYPE.getOrDefault(type, UNCLEAR);
    }
}
