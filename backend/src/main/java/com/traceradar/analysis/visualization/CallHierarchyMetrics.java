package com.traceradar.analysis.visualization;

import com.traceradar.domain.ProcessedCallNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gas and call counts per depth level, keyed in ascending depth order.
 */
public record CallHierarchyMetrics(int maxDepth, Map<Integer, Long> gasPerDepth, Map<Integer, Integer> callsPerDepth) {

    public CallHierarchyMetrics {
        gasPerDepth = Collections.unmodifiableMap(new TreeMap<>(gasPerDepth));
        callsPerDepth = Collections.unmodifiableMap(new TreeMap<>(callsPerDepth));
    }

    public static CallHierarchyMetrics of(List<ProcessedCallNode> nodes) {
        Map<Integer, Long> gas = new TreeMap<>();
        Map<Integer, Integer> calls = new TreeMap<>();
        int maxDepth = 0;
        for (ProcessedCallNode node : nodes) {
            gas.merge(node.depth(), node.gasUsed(), Long::sum);
            calls.merge(node.depth(), 1, Integer::sum);
            maxDepth = Math.max(maxDepth, node.depth());
        }
        return new CallHierarchyMetrics(maxDepth, gas, calls);
    }
}
