package com.traceradar.analysis;

import com.traceradar.common.Percentages;
import com.traceradar.domain.AnalysisSummary;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenTransferEvent;

import java.util.List;

final class SummaryBuilder {

    private SummaryBuilder() {
    }

    static AnalysisSummary build(List<ProcessedCallNode> nodes, List<TokenTransferEvent> transfers,
                                 double complexityScore) {
        if (nodes.isEmpty()) {
            return AnalysisSummary.empty();
        }
        long totalGas = nodes.stream().mapToLong(ProcessedCallNode::gasUsed).sum();
        long trackedGas = nodes.stream().filter(ProcessedCallNode::tracked).mapToLong(ProcessedCallNode::gasUsed).sum();
        int uniqueContracts = (int) nodes.stream()
                .map(ProcessedCallNode::to)
                .filter(to -> to != null && !to.isBlank())
                .distinct()
                .count();
        return new AnalysisSummary(
                nodes.size(),
                totalGas,
                (int) nodes.stream().filter(ProcessedCallNode::hasError).count(),
                (int) nodes.stream().filter(ProcessedCallNode::tracked).count(),
                transfers.size(),
                complexityScore,
                uniqueContracts,
                nodes.stream().mapToInt(ProcessedCallNode::depth).max().orElse(0),
                trackedGas,
                Percentages.round2(Percentages.of(trackedGas, totalGas)));
    }
}
