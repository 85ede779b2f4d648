package com.traceradar.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.traceradar.analysis.gas.GasAnalysis;
import com.traceradar.analysis.gas.GasAnalyzer;
import com.traceradar.analysis.mev.AdvancedMevAnalysis;
import com.traceradar.analysis.mev.AdvancedMevDetector;
import com.traceradar.analysis.mev.BasicMevDetector;
import com.traceradar.analysis.mev.MevAnalysis;
import com.traceradar.analysis.pattern.ComplexityAnalysis;
import com.traceradar.analysis.pattern.ComplexityAnalyzer;
import com.traceradar.analysis.pattern.PatternAnalysis;
import com.traceradar.analysis.pattern.PatternClassifier;
import com.traceradar.analysis.security.AntiPatternReport;
import com.traceradar.analysis.security.SecurityAnalyzer;
import com.traceradar.analysis.security.SecurityAssessment;
import com.traceradar.analysis.visualization.VisualizationData;
import com.traceradar.analysis.visualization.VisualizationProjector;
import com.traceradar.domain.AnalysisSummary;
import com.traceradar.domain.ContractInteractionEdge;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenTransferEvent;
import com.traceradar.ingestion.extractor.InteractionExtractor;
import com.traceradar.ingestion.extractor.TransferExtractor;
import com.traceradar.ingestion.normalizer.NormalizationResult;
import com.traceradar.ingestion.normalizer.TraceNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Runs the analysis stages in order over one fetched trace. Each stage only reads the output of earlier ones;
 * no I/O happens here.
 */
@Component
@RequiredArgsConstructor
public class TraceAnalysisPipeline {

    private final TraceNormalizer normalizer;
    private final InteractionExtractor interactionExtractor;
    private final TransferExtractor transferExtractor;
    private final PatternClassifier patternClassifier;
    private final ComplexityAnalyzer complexityAnalyzer;
    private final GasAnalyzer gasAnalyzer;
    private final BasicMevDetector basicMevDetector;
    private final AdvancedMevDetector advancedMevDetector;
    private final SecurityAnalyzer securityAnalyzer;
    private final VisualizationProjector visualizationProjector;
    private final Clock clock;

    public TraceAnalysisResult run(String txHash, List<JsonNode> traceItems, AnalysisOptions options) {
        NormalizationResult normalized = normalizer.normalize(traceItems);
        return analyzeNodes(txHash, normalized.nodes(), normalized.skippedCount(), options);
    }

    TraceAnalysisResult analyzeNodes(String txHash, List<ProcessedCallNode> nodes, int skipped,
                                     AnalysisOptions options) {
        Instant now = Instant.now(clock);
        if (nodes.isEmpty()) {
            return emptyResult(txHash, skipped, options, now);
        }

        List<ContractInteractionEdge> interactions = interactionExtractor.extract(nodes);
        List<TokenTransferEvent> transfers = transferExtractor.extract(nodes);

        ComplexityAnalysis complexity = complexityAnalyzer.analyze(nodes);
        PatternAnalysis patternAnalysis = options.patternDetection()
                ? PatternAnalysis.of(patternClassifier.classify(nodes, transfers), complexity)
                : PatternAnalysis.disabled(complexity);

        GasAnalysis gasAnalysis = gasAnalyzer.analyze(nodes);

        MevAnalysis mev = options.mevDetection() ? basicMevDetector.detect(nodes) : MevAnalysis.none();
        AdvancedMevAnalysis advancedMev = options.advancedMev()
                ? advancedMevDetector.analyze(nodes, gasAnalysis)
                : AdvancedMevAnalysis.none();

        SecurityAssessment security = options.securityAnalysis()
                ? securityAnalyzer.assess(nodes)
                : SecurityAssessment.empty();
        AntiPatternReport antiPatterns = options.securityAnalysis()
                ? securityAnalyzer.scanAntiPatterns(nodes)
                : AntiPatternReport.none();

        VisualizationData visualization = options.visualization()
                ? visualizationProjector.project(nodes, interactions, transfers)
                : null;

        AnalysisSummary summary = SummaryBuilder.build(nodes, transfers, complexity.score());
        return new TraceAnalysisResult(txHash, false, skipped, summary, nodes, interactions, transfers,
                patternAnalysis, mev, advancedMev, security, antiPatterns, gasAnalysis, visualization, options, now);
    }

    private TraceAnalysisResult emptyResult(String txHash, int skipped, AnalysisOptions options, Instant now) {
        ComplexityAnalysis complexity = complexityAnalyzer.analyze(List.of());
        PatternAnalysis patternAnalysis = PatternAnalysis.of(patternClassifier.classify(List.of(), List.of()), complexity);
        return new TraceAnalysisResult(txHash, true, skipped, AnalysisSummary.empty(), List.of(), List.of(), List.of(),
                patternAnalysis, MevAnalysis.none(), AdvancedMevAnalysis.none(), SecurityAssessment.empty(),
                AntiPatternReport.none(), GasAnalysis.empty(), null, options, now);
    }
}
