package com.traceradar.analysis.visualization;

import java.util.List;

public record ContractGraph(List<Node> nodes, List<Edge> edges) {

    public ContractGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * @param callCount calls received by this address across all edges
     */
    public record Node(String address, String contractName, boolean tracked, int callCount, long gasUsed) {
    }

    public record Edge(String source, String target, int callCount, long gasUsed) {
    }
}
