package com.traceradar.analysis.visualization;

import java.math.BigDecimal;
import java.util.List;

/**
 * Token movements aggregated per sender/recipient pair. Addresses are lower-cased.
 */
public record TokenFlowGraph(List<Node> nodes, List<Edge> edges, BigDecimal totalVolume) {

    public TokenFlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public record Node(String address, BigDecimal sent, BigDecimal received) {
    }

    public record Edge(String from, String to, int transferCount, BigDecimal totalAmount) {
    }
}
