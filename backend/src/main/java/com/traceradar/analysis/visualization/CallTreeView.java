package com.traceradar.analysis.visualization;

import com.traceradar.domain.ProcessedCallNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parent/child view over the flat node arena. Links are derived by trace-address prefix; a node whose parent path
 * is not present in the trace is reported as a root.
 */
public record CallTreeView(List<String> rootIds, List<Entry> entries) {

    public CallTreeView {
        rootIds = List.copyOf(rootIds);
        entries = List.copyOf(entries);
    }

    public record Entry(String id, String parentId, List<String> childIds, ProcessedCallNode call) {

        public Entry {
            childIds = List.copyOf(childIds);
        }
    }

    public static String nodeId(List<Integer> traceAddress) {
        if (traceAddress.isEmpty()) {
            return "node_root";
        }
        return "node_" + traceAddress.stream().map(String::valueOf).collect(Collectors.joining("_"));
    }

    public static CallTreeView of(List<ProcessedCallNode> nodes) {
        Map<String, ProcessedCallNode> byId = new LinkedHashMap<>();
        for (ProcessedCallNode node : nodes) {
            byId.putIfAbsent(nodeId(node.traceAddress()), node);
        }

        Map<String, List<String>> children = new LinkedHashMap<>();
        Map<String, String> parents = new LinkedHashMap<>();
        List<String> roots = new ArrayList<>();
        for (Map.Entry<String, ProcessedCallNode> e : byId.entrySet()) {
            List<Integer> path = e.getValue().traceAddress();
            String parentId = path.isEmpty() ? null : nodeId(path.subList(0, path.size() - 1));
            if (parentId != null && byId.containsKey(parentId)) {
                parents.put(e.getKey(), parentId);
                children.computeIfAbsent(parentId, k -> new ArrayList<>()).add(e.getKey());
            } else {
                roots.add(e.getKey());
            }
        }

        List<Entry> entries = byId.entrySet().stream()
                .map(e -> new Entry(e.getKey(), parents.get(e.getKey()),
                        children.getOrDefault(e.getKey(), List.of()), e.getValue()))
                .toList();
        return new CallTreeView(roots, entries);
    }
}
