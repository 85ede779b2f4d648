package com.traceradar.analysis;

import com.traceradar.analysis.gas.GasAnalyzer;
import com.traceradar.analysis.mev.AdvancedMevDetector;
import com.traceradar.analysis.mev.ArbitrageDetector;
import com.traceradar.analysis.mev.BasicMevDetector;
import com.traceradar.analysis.mev.FrontRunningDetector;
import com.traceradar.analysis.mev.LiquidationMevDetector;
import com.traceradar.analysis.mev.SandwichDetector;
import com.traceradar.analysis.pattern.ComplexityAnalyzer;
import com.traceradar.analysis.pattern.PatternClassifier;
import com.traceradar.analysis.security.CallRiskAssessor;
import com.traceradar.analysis.security.SecurityAnalyzer;
import com.traceradar.analysis.visualization.VisualizationProjector;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenProfile;
import com.traceradar.ingestion.config.ProtocolRegistryProperties;
import com.traceradar.ingestion.config.TrackedContractProperties;
import com.traceradar.ingestion.extractor.InteractionExtractor;
import com.traceradar.ingestion.extractor.TransferExtractor;
import com.traceradar.ingestion.normalizer.DefaultProtocolRegistry;
import com.traceradar.ingestion.normalizer.DefaultTrackedContractRegistry;
import com.traceradar.ingestion.normalizer.FunctionDecoder;
import com.traceradar.ingestion.normalizer.TraceNormalizer;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Pipeline wired from real components, the way the application context wires it.
 */
public final class AnalysisFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private AnalysisFixtures() {
    }

    public static TraceAnalysisPipeline pipeline() {
        TokenProfile pyusd = TokenProfile.pyusd();
        TraceNormalizer normalizer = new TraceNormalizer(
                new DefaultTrackedContractRegistry(new TrackedContractProperties()),
                new DefaultProtocolRegistry(new ProtocolRegistryProperties()),
                new FunctionDecoder());
        AdvancedMevDetector advancedMev = new AdvancedMevDetector(List.of(
                new SandwichDetector(), new ArbitrageDetector(), new FrontRunningDetector(), new LiquidationMevDetector()));
        return new TraceAnalysisPipeline(
                normalizer,
                new InteractionExtractor(),
                new TransferExtractor(pyusd),
                new PatternClassifier(),
                new ComplexityAnalyzer(),
                new GasAnalyzer(),
                new BasicMevDetector(),
                advancedMev,
                new SecurityAnalyzer(pyusd, new CallRiskAssessor(pyusd)),
                new VisualizationProjector(),
                CLOCK);
    }

    /** Runs every stage with default options over already normalized nodes. */
    public static TraceAnalysisResult analyze(String txHash, List<ProcessedCallNode> nodes) {
        return pipeline().analyzeNodes(txHash, nodes, 0, AnalysisOptions.defaults());
    }
}
