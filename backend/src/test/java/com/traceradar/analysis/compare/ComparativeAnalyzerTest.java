package com.traceradar.analysis.compare;

import com.traceradar.analysis.AnalysisFixtures;
import com.traceradar.analysis.TraceAnalysisResult;
import com.traceradar.analysis.pattern.PatternType;
import com.traceradar.analysis.security.SecurityConcern;
import com.traceradar.domain.FunctionParameters;
import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.traceradar.fixtures.CallNodeBuilder.SENDER;
import static com.traceradar.fixtures.CallNodeBuilder.call;
import static com.traceradar.fixtures.CallNodeBuilder.tracked;
import static com.traceradar.fixtures.TraceJson.TRANSFER;
import static com.traceradar.fixtures.TraceJson.TRANSFER_FROM;
import static com.traceradar.fixtures.TraceJson.tokens;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class ComparativeAnalyzerTest {

    private static final String RECIPIENT = "0x2222222222222222222222222222222222222222";

    private final ComparativeAnalyzer analyzer = new ComparativeAnalyzer();

    private TraceAnalysisResult transfer;
    private TraceAnalysisResult swap;

    @BeforeEach
    void setUp() {
        transfer = AnalysisFixtures.analyze("0x" + "1".repeat(64), List.of(
                tracked(KnownFunctions.TRANSFER).selector(TRANSFER).gas(100_000)
                        .parameters(new FunctionParameters(RECIPIENT, null, tokens(10), null, null, null, null))
                        .build()));
        swap = AnalysisFixtures.analyze("0x" + "2".repeat(64), List.of(
                tracked(KnownFunctions.TRANSFER_FROM).selector(TRANSFER_FROM).gas(70_000)
                        .parameters(new FunctionParameters(RECIPIENT, SENDER, tokens(10), null, null, null, null))
                        .build(),
                call().to("0x00000000000000000000000000000000000000c1").at(0).gas(30_000).build(),
                call().to("0x00000000000000000000000000000000000000c2").at(1).gas(30_000).build(),
                call().to("0x00000000000000000000000000000000000000c3").at(2).gas(30_000).build()));
    }

    @Test
    void compare_transferToSwap_reportsPatternGasAndContracts() {
        ComparisonResult result = analyzer.compare(transfer, swap);

        assertThat(result.differences())
                .extracting(ComparisonDifference::type, ComparisonDifference::impact)
                .containsExactly(
                        tuple("pattern_type_change", RiskLevel.MEDIUM),
                        tuple("gas_usage_change", RiskLevel.HIGH),
                        tuple("new_contracts", RiskLevel.MEDIUM));
        assertThat(result.differences().get(1).description()).isEqualTo("Gas usage increased by 60,000 (60.0%)");
        assertThat(result.differences().get(2).description()).isEqualTo(
                "New contract interactions: 0x00000000000000000000000000000000000000c1, "
                        + "0x00000000000000000000000000000000000000c2, 0x00000000000000000000000000000000000000c3");
        assertThat(result.recommendations()).containsExactly(
                "Transaction 2 uses 60,000 more gas. Consider optimizing contract interactions.",
                "Transaction patterns differ. Ensure the change aligns with your intended operation.",
                "Contract interactions have changed. Verify that all necessary contracts are being called.");
    }

    @Test
    void compare_metricsAndSnapshots() {
        ComparisonResult result = analyzer.compare(transfer, swap);

        assertThat(result.metrics().gasUsage()).isEqualTo(new MetricDelta(100_000, 160_000, 60_000, 60.0));
        assertThat(result.metrics().actionCount().percentageChange()).isEqualTo(300.0);
        assertThat(result.metrics().contractCount()).isEqualTo(MetricDelta.of(1, 4));
        assertThat(result.baseline().pattern()).isEqualTo(PatternType.SIMPLE_TRANSFER);
        assertThat(result.target().pattern()).isEqualTo(PatternType.SWAP_OPERATION);
        assertThat(result.target().hasErrors()).isFalse();
    }

    @Test
    void compare_patternComparison() {
        PatternComparison patterns = analyzer.compare(transfer, swap).patternComparison();

        assertThat(patterns.typeChanged()).isTrue();
        assertThat(patterns.confidenceChange()).isCloseTo(-0.2, within(1e-9));
        assertThat(patterns.matchChanges().added()).containsExactly("swap_operation");
        assertThat(patterns.matchChanges().removed()).containsExactly("simple_transfer");
        assertThat(patterns.summary()).isEqualTo("Pattern changed from simple_transfer to swap_operation");
    }

    @Test
    void compare_reversed_reportsSavingsAndRemovedContracts() {
        ComparisonResult result = analyzer.compare(swap, transfer);

        assertThat(result.gasComparison().totalGasChange()).isEqualTo(-60_000L);
        assertThat(result.gasComparison().summary()).isEqualTo("Gas usage decreased by 60,000 (37.5%)");
        assertThat(result.differences()).extracting(ComparisonDifference::type)
                .containsExactly("pattern_type_change", "gas_usage_change", "removed_contracts");
        assertThat(result.recommendations().get(0))
                .isEqualTo("Transaction 2 is more gas efficient, saving 60,000 gas. Good optimization!");
    }

    @Test
    void compare_sameAnalysis_noDifferences() {
        ComparisonResult result = analyzer.compare(transfer, transfer);

        assertThat(result.differences()).isEmpty();
        assertThat(result.recommendations()).isEmpty();
        assertThat(result.patternComparison().summary())
                .isEqualTo("Both transactions follow the same simple_transfer pattern");
        assertThat(result.gasComparison().summary()).isEqualTo("Gas usage remained the same");
        assertThat(result.securityComparison().summary()).isEqualTo("Security profile remained the same");
    }

    @Test
    void compareSecurity_weightsAndMatchesOnLevelAndDescription() {
        SecurityConcern failed = new SecurityConcern(RiskLevel.MEDIUM, "Transaction failed: Reverted", "X", SENDER);
        SecurityConcern owner = new SecurityConcern(RiskLevel.HIGH, "Contract ownership transfer detected", "X", SENDER);
        SecurityConcern failedElsewhere = new SecurityConcern(RiskLevel.MEDIUM, "Transaction failed: Reverted", "Y", RECIPIENT);

        SecurityComparison comparison = analyzer.compareSecurity(List.of(failed), List.of(failedElsewhere, owner));

        assertThat(comparison.riskScoreChange()).isEqualTo(5);
        assertThat(comparison.concernCountChange()).isEqualTo(1);
        assertThat(comparison.newConcerns()).containsExactly(owner);
        assertThat(comparison.resolvedConcerns()).isEmpty();
        assertThat(comparison.summary()).isEqualTo("Security risk increased with 2 total concerns");
    }

    @Test
    void riskScore_weights() {
        List<SecurityConcern> concerns = List.of(
                new SecurityConcern(RiskLevel.LOW, "a", null, null),
                new SecurityConcern(RiskLevel.MEDIUM, "b", null, null),
                new SecurityConcern(RiskLevel.HIGH, "c", null, null),
                new SecurityConcern(RiskLevel.CRITICAL, "d", null, null));

        assertThat(ComparativeAnalyzer.riskScore(concerns)).isEqualTo(19);
    }

    @Test
    void metricDelta_zeroBaseline_neverInfinite() {
        assertThat(MetricDelta.of(0, 0).percentageChange()).isZero();
        assertThat(MetricDelta.of(0, 4).percentageChange()).isEqualTo(100.0);
    }
}
