package com.traceradar.analysis.pattern;

import com.traceradar.common.Percentages;
import com.traceradar.domain.ProcessedCallNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Weighted complexity score in [0, 100] over call depth, distinct targets, call count, gas and error rate.
 */
@Component
public class ComplexityAnalyzer {

    public ComplexityAnalysis analyze(List<ProcessedCallNode> nodes) {
        int maxDepth = nodes.stream().mapToInt(ProcessedCallNode::depth).max().orElse(0);
        long uniqueContracts = nodes.stream()
                .map(ProcessedCallNode::to)
                .filter(Objects::nonNull)
                .filter(to -> !to.isBlank())
                .distinct()
                .count();
        long totalGas = nodes.stream().mapToLong(ProcessedCallNode::gasUsed).sum();
        long errors = nodes.stream().filter(ProcessedCallNode::hasError).count();
        double errorRate = Percentages.of(errors, nodes.size());

        List<ComplexityFactor> factors = List.of(
                new ComplexityFactor("Call Depth", maxDepth, 0.30, Math.min(maxDepth * 10.0, 50.0)),
                new ComplexityFactor("Unique Contracts", uniqueContracts, 0.25, Math.min(uniqueContracts * 5.0, 30.0)),
                new ComplexityFactor("Total Calls", nodes.size(), 0.20, Math.min(nodes.size() * 2.0, 40.0)),
                new ComplexityFactor("Gas Usage", totalGas, 0.15, Math.min(totalGas / 100_000.0, 20.0)),
                new ComplexityFactor("Error Rate", errorRate, 0.10, errorRate * 2.0)
        );
        double raw = factors.stream().mapToDouble(ComplexityFactor::weighted).sum();
        double score = Math.max(0.0, Math.min(100.0, raw));
        return new ComplexityAnalysis(score, ComplexityLevel.of(score), factors);
    }
}
