package com.traceradar.analysis.compare;

import com.traceradar.analysis.TraceAnalysisResult;
import com.traceradar.analysis.gas.OptimizationSuggestion;
import com.traceradar.analysis.pattern.PatternAnalysis;
import com.traceradar.analysis.pattern.PatternMatch;
import com.traceradar.analysis.pattern.PatternType;
import com.traceradar.analysis.security.SecurityConcern;
import com.traceradar.common.Percentages;
import com.traceradar.common.TokenAmounts;
import com.traceradar.domain.ContractInteractionEdge;
import com.traceradar.domain.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Diffs two completed analyses. Never triggers analysis itself.
 */
@Component
public class ComparativeAnalyzer {

    static final double GAS_CHANGE_THRESHOLD = 10.0;
    static final double GAS_HIGH_IMPACT_THRESHOLD = 25.0;
    private static final int LISTED_CONTRACTS = 3;
    private static final Map<RiskLevel, Integer> RISK_WEIGHTS = Map.of(
            RiskLevel.LOW, 1, RiskLevel.MEDIUM, 3, RiskLevel.HIGH, 5, RiskLevel.CRITICAL, 10);

    public ComparisonResult compare(TraceAnalysisResult baseline, TraceAnalysisResult target) {
        List<ComparisonDifference> differences = differences(baseline, target);
        return new ComparisonResult(
                snapshot(baseline),
                snapshot(target),
                metrics(baseline, target),
                differences,
                comparePatterns(baseline.patternAnalysis(), target.patternAnalysis()),
                compareGas(baseline, target),
                compareSecurity(baseline.securityAssessment().concerns(), target.securityAssessment().concerns()),
                recommendations(baseline, target, differences));
    }

    ComparisonMetrics metrics(TraceAnalysisResult baseline, TraceAnalysisResult target) {
        return new ComparisonMetrics(
                MetricDelta.of(baseline.processedNodes().size(), target.processedNodes().size()),
                MetricDelta.of(baseline.gasAnalysis().totalGas(), target.gasAnalysis().totalGas()),
                MetricDelta.of(baseline.summary().uniqueContracts(), target.summary().uniqueContracts()),
                MetricDelta.of(baseline.maxDepth(), target.maxDepth()),
                MetricDelta.of(baseline.errorCount(), target.errorCount()));
    }

    List<ComparisonDifference> differences(TraceAnalysisResult baseline, TraceAnalysisResult target) {
        List<ComparisonDifference> out = new ArrayList<>();

        String basePattern = baseline.patternAnalysis().pattern().type().label();
        String targetPattern = target.patternAnalysis().pattern().type().label();
        if (!basePattern.equals(targetPattern)) {
            out.add(new ComparisonDifference(DifferenceCategory.PATTERN, "pattern_type_change",
                    "Transaction pattern changed from " + basePattern + " to " + targetPattern,
                    RiskLevel.MEDIUM, basePattern, targetPattern));
        }

        long baseGas = baseline.gasAnalysis().totalGas();
        long targetGas = target.gasAnalysis().totalGas();
        double gasPct = Percentages.change(baseGas, targetGas);
        if (Math.abs(gasPct) > GAS_CHANGE_THRESHOLD) {
            out.add(new ComparisonDifference(DifferenceCategory.GAS, "gas_usage_change",
                    gasChangeText(targetGas - baseGas, gasPct),
                    Math.abs(gasPct) > GAS_HIGH_IMPACT_THRESHOLD ? RiskLevel.HIGH : RiskLevel.MEDIUM,
                    Long.toString(baseGas), Long.toString(targetGas)));
        }

        int baseConcerns = baseline.securityAssessment().concerns().size();
        int targetConcerns = target.securityAssessment().concerns().size();
        if (baseConcerns != targetConcerns) {
            boolean increased = targetConcerns > baseConcerns;
            out.add(new ComparisonDifference(DifferenceCategory.SECURITY, "security_concern_change",
                    "Security concerns " + (increased ? "increased" : "decreased") + " from " + baseConcerns
                            + " to " + targetConcerns,
                    increased ? RiskLevel.HIGH : RiskLevel.LOW,
                    Integer.toString(baseConcerns), Integer.toString(targetConcerns)));
        }

        Set<String> baseTargets = interactionTargets(baseline.interactions());
        Set<String> targetTargets = interactionTargets(target.interactions());
        List<String> added = targetTargets.stream().filter(t -> !baseTargets.contains(t)).toList();
        List<String> removed = baseTargets.stream().filter(t -> !targetTargets.contains(t)).toList();
        if (!added.isEmpty()) {
            out.add(new ComparisonDifference(DifferenceCategory.CONTRACTS, "new_contracts",
                    "New contract interactions: " + listed(added), RiskLevel.MEDIUM,
                    "N/A", Integer.toString(added.size())));
        }
        if (!removed.isEmpty()) {
            out.add(new ComparisonDifference(DifferenceCategory.CONTRACTS, "removed_contracts",
                    "Removed contract interactions: " + listed(removed), RiskLevel.MEDIUM,
                    Integer.toString(removed.size()), "N/A"));
        }
        return out;
    }

    PatternComparison comparePatterns(PatternAnalysis baseline, PatternAnalysis target) {
        String basePattern = baseline.pattern().type().label();
        String targetPattern = target.pattern().type().label();
        boolean changed = !basePattern.equals(targetPattern);
        return new PatternComparison(
                changed,
                target.pattern().confidence() - baseline.pattern().confidence(),
                target.complexity().score() - baseline.complexity().score(),
                ListDiff.between(matchLabels(baseline), matchLabels(target)),
                changed
                        ? "Pattern changed from " + basePattern + " to " + targetPattern
                        : "Both transactions follow the same " + basePattern + " pattern");
    }

    GasComparison compareGas(TraceAnalysisResult baseline, TraceAnalysisResult target) {
        long change = target.gasAnalysis().totalGas() - baseline.gasAnalysis().totalGas();
        double pct = Percentages.change(baseline.gasAnalysis().totalGas(), target.gasAnalysis().totalGas());
        List<String> baseTitles = baseline.gasAnalysis().suggestions().stream().map(OptimizationSuggestion::title).toList();
        List<String> targetTitles = target.gasAnalysis().suggestions().stream().map(OptimizationSuggestion::title).toList();
        return new GasComparison(change, pct,
                baseline.gasAnalysis().category() != target.gasAnalysis().category(),
                ListDiff.between(baseTitles, targetTitles),
                change == 0 ? "Gas usage remained the same" : gasChangeText(change, pct));
    }

    SecurityComparison compareSecurity(List<SecurityConcern> baseline, List<SecurityConcern> target) {
        int baseRisk = riskScore(baseline);
        int targetRisk = riskScore(target);
        List<SecurityConcern> added = target.stream().filter(c -> !containsConcern(baseline, c)).toList();
        List<SecurityConcern> resolved = baseline.stream().filter(c -> !containsConcern(target, c)).toList();
        String summary = baseline.size() == target.size() && baseRisk == targetRisk
                ? "Security profile remained the same"
                : "Security " + (targetRisk > baseRisk ? "risk increased" : "risk decreased") + " with "
                + target.size() + " total concerns";
        return new SecurityComparison(targetRisk - baseRisk, target.size() - baseline.size(), added, resolved, summary);
    }

    List<String> recommendations(TraceAnalysisResult baseline, TraceAnalysisResult target,
                                 List<ComparisonDifference> differences) {
        List<String> out = new ArrayList<>();
        long change = target.gasAnalysis().totalGas() - baseline.gasAnalysis().totalGas();
        if (change > 0) {
            out.add("Transaction 2 uses " + TokenAmounts.format(change)
                    + " more gas. Consider optimizing contract interactions.");
        } else if (change < 0) {
            out.add("Transaction 2 is more gas efficient, saving " + TokenAmounts.format(-change)
                    + " gas. Good optimization!");
        }
        boolean securityEscalated = differences.stream()
                .anyMatch(d -> d.category() == DifferenceCategory.SECURITY && d.impact() == RiskLevel.HIGH);
        if (securityEscalated) {
            out.add("Security concerns have changed significantly. Review the security analysis for both transactions.");
        }
        if (differences.stream().anyMatch(d -> d.category() == DifferenceCategory.PATTERN)) {
            out.add("Transaction patterns differ. Ensure the change aligns with your intended operation.");
        }
        if (differences.stream().anyMatch(d -> d.category() == DifferenceCategory.CONTRACTS)) {
            out.add("Contract interactions have changed. Verify that all necessary contracts are being called.");
        }
        return out;
    }

    TransactionSnapshot snapshot(TraceAnalysisResult analysis) {
        return new TransactionSnapshot(
                analysis.transactionHash(),
                analysis.patternAnalysis().pattern().type(),
                analysis.gasAnalysis().totalGas(),
                analysis.processedNodes().size(),
                analysis.summary().uniqueContracts(),
                analysis.securityAssessment().overallRisk(),
                riskScore(analysis.securityAssessment().concerns()),
                analysis.errorCount() > 0);
    }

    static int riskScore(List<SecurityConcern> concerns) {
        return concerns.stream().mapToInt(c -> RISK_WEIGHTS.get(c.level())).sum();
    }

    private static boolean containsConcern(List<SecurityConcern> concerns, SecurityConcern concern) {
        return concerns.stream().anyMatch(c -> c.level() == concern.level()
                && c.description().equals(concern.description()));
    }

    private static String gasChangeText(long change, double pct) {
        return String.format(Locale.US, "Gas usage %s by %s (%.1f%%)",
                change > 0 ? "increased" : "decreased", TokenAmounts.format(Math.abs(change)), Math.abs(pct));
    }

    private static List<String> matchLabels(PatternAnalysis analysis) {
        return analysis.pattern().matches().stream().map(PatternMatch::type).map(PatternType::label).toList();
    }

    private static Set<String> interactionTargets(List<ContractInteractionEdge> interactions) {
        Set<String> targets = new LinkedHashSet<>();
        interactions.forEach(edge -> targets.add(edge.to()));
        return targets;
    }

    private static String listed(List<String> addresses) {
        String head = String.join(", ", addresses.subList(0, Math.min(LISTED_CONTRACTS, addresses.size())));
        return addresses.size() > LISTED_CONTRACTS ? head + "..." : head;
    }
}
