package com.traceradar.analysis.visualization;

import java.util.List;

/**
 * Call tree as nodes and parent-to-child edges. Node ids are {@code node_root} or {@code node_<path joined by _>}.
 */
public record CallGraph(List<Node> nodes, List<Edge> edges, CallHierarchyMetrics metrics) {

    public CallGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public record Node(
            String id,
            List<Integer> traceAddress,
            int depth,
            String callType,
            String functionName,
            String contractName,
            String from,
            String to,
            long gasUsed,
            boolean tracked,
            boolean hasError
    ) {
    }

    public record Edge(String source, String target, String callType, long gasUsed, boolean success) {
    }
}
