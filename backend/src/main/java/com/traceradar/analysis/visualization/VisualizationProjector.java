package com.traceradar.analysis.visualization;

import com.traceradar.domain.ContractInteractionEdge;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenTransferEvent;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Re-shapes already computed analysis data into graph form. Performs no inference of its own.
 */
@Component
public class VisualizationProjector {

    public VisualizationData project(List<ProcessedCallNode> nodes,
                                     List<ContractInteractionEdge> interactions,
                                     List<TokenTransferEvent> transfers) {
        return new VisualizationData(callGraph(nodes), contractGraph(nodes, interactions), tokenFlow(transfers));
    }

    CallGraph callGraph(List<ProcessedCallNode> nodes) {
        if (nodes.isEmpty()) {
            return null;
        }
        List<CallGraph.Node> graphNodes = new ArrayList<>();
        for (ProcessedCallNode node : nodes) {
            graphNodes.add(new CallGraph.Node(CallTreeView.nodeId(node.traceAddress()), node.traceAddress(),
                    node.depth(), node.callType(), node.functionName(), node.contractName(), node.from(), node.to(),
                    node.gasUsed(), node.tracked(), node.hasError()));
        }
        Set<String> ids = graphNodes.stream().map(CallGraph.Node::id).collect(Collectors.toSet());

        List<CallGraph.Edge> edges = new ArrayList<>();
        for (ProcessedCallNode node : nodes) {
            List<Integer> path = node.traceAddress();
            if (path.isEmpty()) {
                continue;
            }
            String parentId = CallTreeView.nodeId(path.subList(0, path.size() - 1));
            String childId = CallTreeView.nodeId(path);
            if (ids.contains(parentId)) {
                edges.add(new CallGraph.Edge(parentId, childId, node.callType(), node.gasUsed(), !node.hasError()));
            }
        }
        return new CallGraph(graphNodes, edges, CallHierarchyMetrics.of(nodes));
    }

    ContractGraph contractGraph(List<ProcessedCallNode> nodes, List<ContractInteractionEdge> interactions) {
        if (interactions.isEmpty()) {
            return null;
        }
        Map<String, ProcessedCallNode> firstCallTo = new LinkedHashMap<>();
        for (ProcessedCallNode node : nodes) {
            if (node.to() != null) {
                firstCallTo.putIfAbsent(node.to(), node);
            }
        }

        Map<String, int[]> calls = new LinkedHashMap<>();
        Map<String, long[]> gas = new LinkedHashMap<>();
        List<ContractGraph.Edge> edges = new ArrayList<>();
        for (ContractInteractionEdge interaction : interactions) {
            calls.computeIfAbsent(interaction.from(), k -> new int[1]);
            gas.computeIfAbsent(interaction.from(), k -> new long[1])[0] += interaction.totalGas();
            calls.computeIfAbsent(interaction.to(), k -> new int[1])[0] += interaction.callCount();
            gas.computeIfAbsent(interaction.to(), k -> new long[1])[0] += interaction.totalGas();
            edges.add(new ContractGraph.Edge(interaction.from(), interaction.to(), interaction.callCount(),
                    interaction.totalGas()));
        }

        List<ContractGraph.Node> graphNodes = new ArrayList<>();
        for (Map.Entry<String, int[]> entry : calls.entrySet()) {
            ProcessedCallNode call = firstCallTo.get(entry.getKey());
            String name = call == null ? "External Account" : call.contractName();
            boolean tracked = call != null && call.tracked();
            graphNodes.add(new ContractGraph.Node(entry.getKey(), name, tracked, entry.getValue()[0],
                    gas.get(entry.getKey())[0]));
        }
        return new ContractGraph(graphNodes, edges);
    }

    TokenFlowGraph tokenFlow(List<TokenTransferEvent> transfers) {
        if (transfers.isEmpty()) {
            return null;
        }
        Map<String, TokenFlowGraph.Edge> edges = new LinkedHashMap<>();
        Map<String, BigDecimal[]> totals = new LinkedHashMap<>();
        BigDecimal volume = BigDecimal.ZERO;
        for (TokenTransferEvent transfer : transfers) {
            String from = transfer.from().toLowerCase();
            String to = transfer.to().toLowerCase();
            BigDecimal amount = transfer.amount();
            volume = volume.add(amount);
            edges.merge(from + ":" + to, new TokenFlowGraph.Edge(from, to, 1, amount),
                    (a, b) -> new TokenFlowGraph.Edge(a.from(), a.to(), a.transferCount() + 1,
                            a.totalAmount().add(b.totalAmount())));
            BigDecimal[] sender = totals.computeIfAbsent(from, k -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            sender[0] = sender[0].add(amount);
            BigDecimal[] recipient = totals.computeIfAbsent(to, k -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
            recipient[1] = recipient[1].add(amount);
        }
        List<TokenFlowGraph.Node> graphNodes = totals.entrySet().stream()
                .map(e -> new TokenFlowGraph.Node(e.getKey(), e.getValue()[0], e.getValue()[1]))
                .toList();
        return new TokenFlowGraph(graphNodes, new ArrayList<>(edges.values()), volume);
    }
}
