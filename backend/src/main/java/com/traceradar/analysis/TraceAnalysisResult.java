package com.traceradar.analysis;

import com.traceradar.analysis.gas.GasAnalysis;
import com.traceradar.analysis.mev.AdvancedMevAnalysis;
import com.traceradar.analysis.mev.MevAnalysis;
import com.traceradar.analysis.pattern.PatternAnalysis;
import com.traceradar.analysis.security.AntiPatternReport;
import com.traceradar.analysis.security.SecurityAssessment;
import com.traceradar.analysis.visualization.VisualizationData;
import com.traceradar.domain.AnalysisSummary;
import com.traceradar.domain.ContractInteractionEdge;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenTransferEvent;

import java.time.Instant;
import java.util.List;

/**
 * Complete analysis of one transaction trace.
 *
 * @param empty          true when the trace held no usable call; every sub-result is then zeroed
 * @param skippedRecords malformed trace items dropped by normalization
 * @param visualization  null when not requested or when the trace is empty
 */
public record TraceAnalysisResult(
        String transactionHash,
        boolean empty,
        int skippedRecords,
        AnalysisSummary summary,
        List<ProcessedCallNode> processedNodes,
        List<ContractInteractionEdge> interactions,
        List<TokenTransferEvent> transfers,
        PatternAnalysis patternAnalysis,
        MevAnalysis mevAnalysis,
        AdvancedMevAnalysis advancedMev,
        SecurityAssessment securityAssessment,
        AntiPatternReport antiPatterns,
        GasAnalysis gasAnalysis,
        VisualizationData visualization,
        AnalysisOptions options,
        Instant analyzedAt
) {

    public TraceAnalysisResult {
        processedNodes = List.copyOf(processedNodes);
        interactions = List.copyOf(interactions);
        transfers = List.copyOf(transfers);
    }

    public int maxDepth() {
        return processedNodes.stream().mapToInt(ProcessedCallNode::depth).max().orElse(0);
    }

    public int errorCount() {
        return (int) processedNodes.stream().filter(ProcessedCallNode::hasError).count();
    }
}
