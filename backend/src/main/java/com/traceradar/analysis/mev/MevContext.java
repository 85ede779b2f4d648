package com.traceradar.analysis.mev;

import com.traceradar.analysis.gas.GasAnalysis;
import com.traceradar.domain.ProcessedCallNode;

import java.util.List;

/**
 * Input shared by the advanced detectors.
 */
public record MevContext(List<ProcessedCallNode> nodes, GasAnalysis gasAnalysis) {

    public MevContext {
        nodes = List.copyOf(nodes);
    }

    public long totalGas() {
        return nodes.stream().mapToLong(ProcessedCallNode::gasUsed).sum();
    }

    public int maxDepth() {
        return nodes.stream().mapToInt(ProcessedCallNode::depth).max().orElse(0);
    }

    public List<ProcessedCallNode> dexCalls() {
        return nodes.stream().filter(CallHeuristics::isDexShaped).toList();
    }
}
