package com.traceradar.analysis.gas;

import com.traceradar.domain.FunctionCategory;
import com.traceradar.domain.FunctionParameters;
import com.traceradar.domain.GasUsageCategory;
import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.traceradar.fixtures.CallNodeBuilder.call;
import static com.traceradar.fixtures.CallNodeBuilder.tracked;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class GasAnalyzerTest {

    private static final String SPENDER = "0x2222222222222222222222222222222222222222";

    private final GasAnalyzer analyzer = new GasAnalyzer();

    @Test
    void analyze_singleTransfer_gradesAgainstBenchmark() {
        GasAnalysis analysis = analyzer.analyze(List.of(
                tracked(KnownFunctions.TRANSFER).category(FunctionCategory.TOKEN_MOVEMENT).gas(52_000).build()));

        assertThat(analysis.totalGas()).isEqualTo(52_000L);
        assertThat(analysis.category()).isEqualTo(GasUsageCategory.LOW);
        assertThat(analysis.benchmarkComparisons()).singleElement().satisfies(c -> {
            assertThat(c.benchmarkGas()).isEqualTo(65_000L);
            assertThat(c.efficiency()).isEqualTo(EfficiencyFlag.EXCELLENT);
            assertThat(c.difference()).isEqualTo(-13_000L);
            assertThat(c.percentageDiff()).isEqualTo(-20.0);
        });
        assertThat(analysis.byFunction().get(0).efficiency().flag()).isEqualTo(EfficiencyFlag.EXCELLENT);
        assertThat(analysis.distribution()).extracting(GasDistributionEntry::category, GasDistributionEntry::percentage)
                .containsExactly(tuple("PYUSD Token", 100.0));
        assertThat(analysis.breakdown()).extracting(GasBreakdownEntry::category)
                .containsExactly(FunctionCategory.TOKEN_MOVEMENT);
        assertThat(analysis.efficiencyMetrics()).extracting(EfficiencyMetric::name, EfficiencyMetric::score)
                .containsExactly(
                        tuple("Average Gas per Call", 70),
                        tuple("PYUSD Operations Efficiency", 90),
                        tuple("Success Rate", 95),
                        tuple("Call Depth Complexity", 90));
        assertThat(analysis.suggestions()).isEmpty();
    }

    @Test
    void byFunction_skipsUndecodedCalls() {
        GasAnalysis analysis = analyzer.analyze(List.of(
                tracked(KnownFunctions.TRANSFER).gas(52_000).build(),
                call().functionName(KnownFunctions.NOT_DECODED).at(0).gas(8_000).build()));

        assertThat(analysis.byFunction()).extracting(FunctionGasUsage::functionName, FunctionGasUsage::gasUsed)
                .containsExactly(tuple(KnownFunctions.TRANSFER, 52_000L));
    }

    @Test
    void analyze_fourTransfers_suggestsBatching() {
        List<ProcessedCallNode> nodes = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            nodes.add(tracked(KnownFunctions.TRANSFER).at(i).gas(52_000).build());
        }

        List<OptimizationSuggestion> suggestions = analyzer.analyze(nodes).suggestions();

        assertThat(suggestions).extracting(OptimizationSuggestion::id).containsExactly("batch_transfers");
        assertThat(suggestions.get(0).potentialSavingsGas()).isEqualTo(62_400L);
        assertThat(suggestions.get(0).description()).isEqualTo("4 individual transfers detected");
    }

    @Test
    void analyze_approvalWithoutSpenderTransfer_flaggedUnused() {
        ProcessedCallNode approve = tracked(KnownFunctions.APPROVE).gas(46_000)
                .parameters(new FunctionParameters(null, null, BigInteger.TEN, SPENDER, null, null, null)).build();

        assertThat(analyzer.analyze(List.of(approve)).suggestions())
                .extracting(OptimizationSuggestion::id).containsExactly("unused_approvals");

        ProcessedCallNode spend = tracked(KnownFunctions.TRANSFER_FROM).from(SPENDER.toUpperCase().replace("0X", "0x"))
                .at(0).gas(70_000).build();
        assertThat(analyzer.analyze(List.of(approve, spend)).suggestions()).isEmpty();
    }

    @Test
    void analyze_failedHeavyCall_reportsWasteAndHighGas() {
        GasAnalysis analysis = analyzer.analyze(List.of(call().gas(300_000).error("out of gas").build()));

        assertThat(analysis.category()).isEqualTo(GasUsageCategory.MODERATE);
        assertThat(analysis.suggestions()).extracting(OptimizationSuggestion::id, OptimizationSuggestion::severity)
                .containsExactly(
                        tuple("failed_operations", RiskLevel.HIGH),
                        tuple("high_gas_operations", RiskLevel.MEDIUM));
        assertThat(analysis.suggestions().get(0).potentialSavingsGas()).isEqualTo(300_000L);
        assertThat(analysis.suggestions().get(0).potentialSavingsPercentage()).isEqualTo(100.0);
        assertThat(analysis.distribution()).extracting(GasDistributionEntry::category).containsExactly("External Contract");
    }

    @Test
    void analyze_manyDeepCalls_reportsStructureAndTotal() {
        List<ProcessedCallNode> nodes = new ArrayList<>();
        for (int i = 0; i < 21; i++) {
            nodes.add(call().at(0, 0, 0, 0, 0, i).gas(30_000).build());
        }

        GasAnalysis analysis = analyzer.analyze(nodes);

        assertThat(analysis.category()).isEqualTo(GasUsageCategory.HIGH);
        assertThat(analysis.suggestions()).extracting(OptimizationSuggestion::id)
                .containsExactly("deep_call_stack", "high_total_gas", "many_calls");
        assertThat(analysis.suggestions().get(1).description()).isEqualTo("Transaction consumed 630,000 gas");
    }

    @Test
    void benchmarkComparisons_sortedByAbsoluteDeviation() {
        List<ProcessedCallNode> nodes = List.of(
                tracked(KnownFunctions.TRANSFER).gas(52_000).build(),
                tracked(KnownFunctions.APPROVE).at(0).gas(58_000).build(),
                tracked("pause()").at(1).gas(30_000).build());

        assertThat(analyzer.analyze(nodes).benchmarkComparisons())
                .extracting(BenchmarkComparison::functionName, BenchmarkComparison::efficiency)
                .containsExactly(
                        tuple(KnownFunctions.APPROVE, EfficiencyFlag.AVERAGE),
                        tuple(KnownFunctions.TRANSFER, EfficiencyFlag.EXCELLENT));
    }

    @Test
    void distributionCategory_byTrackedContractName() {
        assertThat(GasAnalyzer.distributionCategory(tracked("mint").contractName("Supply Control").build()))
                .isEqualTo("Supply Control");
        assertThat(GasAnalyzer.distributionCategory(tracked("x").contractName("PYUSD Implementation").build()))
                .isEqualTo("Other PYUSD");
    }

    @Test
    void analyze_empty_isEmpty() {
        assertThat(analyzer.analyze(List.of())).isEqualTo(GasAnalysis.empty());
    }
}
