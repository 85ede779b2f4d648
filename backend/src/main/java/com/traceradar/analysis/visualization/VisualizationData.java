package com.traceradar.analysis.visualization;

/**
 * Graph projections of an analysis. A graph is null when its input list is empty.
 */
public record VisualizationData(CallGraph callGraph, ContractGraph contractGraph, TokenFlowGraph tokenFlow) {
}
