package com.traceradar.ingestion.extractor;

import com.traceradar.domain.ContractInteractionEdge;
import com.traceradar.domain.ProcessedCallNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates calls into (from, to) edges, in order of first appearance. Addresses are compared as given.
 */
@Component
public class InteractionExtractor {

    public List<ContractInteractionEdge> extract(List<ProcessedCallNode> nodes) {
        Map<EdgeKey, long[]> totals = new LinkedHashMap<>();
        for (ProcessedCallNode node : nodes) {
            if (isBlank(node.from()) || isBlank(node.to()) || node.from().equals(node.to())) {
                continue;
            }
            long[] acc = totals.computeIfAbsent(new EdgeKey(node.from(), node.to()), k -> new long[2]);
            acc[0]++;
            acc[1] += node.gasUsed();
        }
        return totals.entrySet().stream()
                .map(e -> new ContractInteractionEdge(e.getKey().from(), e.getKey().to(), (int) e.getValue()[0], e.getValue()[1]))
                .toList();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private record EdgeKey(String from, String to) {
    }
}
