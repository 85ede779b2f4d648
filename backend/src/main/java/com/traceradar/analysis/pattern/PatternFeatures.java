package com.traceradar.analysis.pattern;

import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenTransferEvent;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts the pattern rules are evaluated over.
 *
 * @param externalCalls plain CALLs to untracked contracts
 * @param trackedMintLikeCalls tracked calls whose function name contains "mint"
 */
public record PatternFeatures(
        int trackedCalls,
        int distinctTrackedTargets,
        Map<String, Integer> callsByFunction,
        int transferCount,
        int externalCalls,
        long totalGas,
        int trackedMintLikeCalls
) {

    public PatternFeatures {
        callsByFunction = Map.copyOf(callsByFunction);
    }

    public int calls(String functionName) {
        return callsByFunction.getOrDefault(functionName, 0);
    }

    public static PatternFeatures from(List<ProcessedCallNode> nodes, List<TokenTransferEvent> transfers) {
        int trackedCalls = 0;
        int externalCalls = 0;
        int mintLike = 0;
        long totalGas = 0;
        Set<String> trackedTargets = new HashSet<>();
        Map<String, Integer> byFunction = new HashMap<>();
        for (ProcessedCallNode node : nodes) {
            totalGas += node.gasUsed();
            if (node.tracked()) {
                trackedCalls++;
                trackedTargets.add(node.to());
                if (node.functionName() != null && !KnownFunctions.NOT_DECODED.equals(node.functionName())) {
                    byFunction.merge(node.functionName(), 1, Integer::sum);
                }
                if (node.functionNameContains("mint")) {
                    mintLike++;
                }
            } else if ("CALL".equals(node.callType())) {
                externalCalls++;
            }
        }
        return new PatternFeatures(trackedCalls, trackedTargets.size(), byFunction, transfers.size(), externalCalls,
                totalGas, mintLike);
    }
}
