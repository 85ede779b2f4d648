package com.traceradar.analysis.pattern;

import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenTransferEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Evaluates every rule independently and ranks the matches by confidence (stable, so ties keep rule order).
 */
@Component
public class PatternClassifier {

    private final List<PatternRule> rules;

    public PatternClassifier() {
        this(PatternRules.DEFAULT);
    }

    PatternClassifier(List<PatternRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public TransactionPattern classify(List<ProcessedCallNode> nodes, List<TokenTransferEvent> transfers) {
        if (nodes.isEmpty()) {
            return TransactionPattern.unknown();
        }
        PatternFeatures features = PatternFeatures.from(nodes, transfers);
        List<PatternMatch> matches = new ArrayList<>();
        for (PatternRule rule : rules) {
            rule.evaluate(features).ifPresent(matches::add);
        }
        if (matches.isEmpty()) {
            return TransactionPattern.unknown();
        }
        matches.sort(Comparator.comparingDouble(PatternMatch::confidence).reversed());
        return new TransactionPattern(matches.get(0), matches);
    }
}
