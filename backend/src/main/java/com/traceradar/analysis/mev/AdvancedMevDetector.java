package com.traceradar.analysis.mev;

import com.traceradar.analysis.gas.GasAnalysis;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs every {@link MevPatternDetector} and aggregates their findings into a score and risk level.
 */
@Slf4j
@Component
public class AdvancedMevDetector {

    private final List<MevPatternDetector> detectors;

    public AdvancedMevDetector(List<MevPatternDetector> detectors) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparing(MevPatternDetector::type))
                .toList();
    }

    public AdvancedMevAnalysis analyze(List<ProcessedCallNode> nodes, GasAnalysis gasAnalysis) {
        if (nodes.isEmpty()) {
            return AdvancedMevAnalysis.none();
        }
        MevContext context = new MevContext(nodes, gasAnalysis);

        List<MevDetection> detections = new ArrayList<>();
        List<MevIndicator> indicators = new ArrayList<>();
        List<MevPattern> patterns = new ArrayList<>();
        for (MevPatternDetector detector : detectors) {
            MevDetection detection = detector.detect(context);
            detections.add(detection);
            if (detection.detected()) {
                indicators.addAll(detection.indicators());
                patterns.add(detection.pattern());
            }
        }

        double score = score(indicators, patterns);
        RiskLevel risk = riskLevel(score, patterns);
        BigDecimal extracted = patterns.stream()
                .map(MevPattern::extractedValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (!patterns.isEmpty()) {
            log.debug("MEV patterns {} score={} risk={}", patterns.stream().map(MevPattern::type).toList(), score, risk);
        }
        return new AdvancedMevAnalysis(!patterns.isEmpty(), score, risk, indicators, patterns, extracted, detections,
                recommendations(patterns, indicators));
    }

    static double score(List<MevIndicator> indicators, List<MevPattern> patterns) {
        double indicatorScore = CallHeuristics.meanConfidence(indicators);
        double patternScore = patterns.stream().mapToDouble(MevPattern::confidence).average().orElse(0.0);
        return (indicatorScore + patternScore) / 2;
    }

    static RiskLevel riskLevel(double score, List<MevPattern> patterns) {
        boolean highSeverity = patterns.stream().anyMatch(p -> p.severity() == RiskLevel.HIGH);
        if (score > 0.8 || highSeverity) {
            return RiskLevel.CRITICAL;
        }
        if (score > 0.6) {
            return RiskLevel.HIGH;
        }
        if (score > 0.3) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static List<String> recommendations(List<MevPattern> patterns, List<MevIndicator> indicators) {
        List<String> out = new ArrayList<>();
        if (hasPattern(patterns, MevPatternType.SANDWICH_ATTACK)) {
            out.add("Consider using private mempools to avoid sandwich attacks");
            out.add("Implement slippage protection in your transactions");
        }
        if (hasPattern(patterns, MevPatternType.FRONT_RUNNING)) {
            out.add("Use commit-reveal schemes for sensitive transactions");
            out.add("Consider using flashbots or similar MEV protection services");
        }
        if (hasPattern(patterns, MevPatternType.ARBITRAGE)) {
            out.add("Monitor for arbitrage opportunities in your protocol");
            out.add("Consider implementing dynamic fees to capture MEV");
        }
        if (indicators.stream().anyMatch(i -> "high_gas_price".equals(i.type()))) {
            out.add("Optimize gas usage to reduce MEV extraction costs");
        }
        return out;
    }

    private static boolean hasPattern(List<MevPattern> patterns, MevPatternType type) {
        return patterns.stream().anyMatch(p -> p.type() == type);
    }
}
