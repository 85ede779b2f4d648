package com.traceradar.analysis.mev;

import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.traceradar.analysis.mev.MevFixtures.context;
import static com.traceradar.fixtures.CallNodeBuilder.call;
import static com.traceradar.fixtures.CallNodeBuilder.tracked;
import static org.assertj.core.api.Assertions.assertThat;

class FrontRunningDetectorTest {

    private final FrontRunningDetector detector = new FrontRunningDetector();

    @Test
    void detect_transferWellAboveBenchmark_firesOnGasAndShape() {
        MevDetection detection = detector.detect(context(List.of(tracked(KnownFunctions.TRANSFER).gas(100_000).build())));

        assertThat(detection.indicators()).extracting(MevIndicator::type)
                .containsExactly("high_gas_price", "frontrun_bot_pattern");
        assertThat(detection.indicators().get(0).evidence()).containsEntry("benchmarkGas", 65_000L);
        assertThat(detection.pattern().severity()).isEqualTo(RiskLevel.HIGH);
        assertThat(detection.pattern().confidence()).isEqualTo(0.7);
        assertThat(detection.pattern().extractedValue()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void detect_singleIndicatorIsEnough() {
        List<ProcessedCallNode> nodes = List.of(
                call().gas(40_000).build(), call().at(0).gas(40_000).build(), call().at(1).gas(40_000).build(),
                call().at(2).gas(0).build(), call().at(3).gas(40_000).build());

        MevDetection detection = detector.detect(context(nodes));

        assertThat(detection.indicators()).extracting(MevIndicator::type).containsExactly("timing_pattern");
        assertThat(detection.pattern().confidence()).isEqualTo(0.5);
    }

    @Test
    void detect_longCheapTraceWithoutBenchmarks_none() {
        List<ProcessedCallNode> nodes = List.of(
                call().gas(10_000).build(), call().at(0).gas(10_000).build(), call().at(1).gas(10_000).build(),
                call().at(2).gas(10_000).build(), call().at(3).gas(10_000).build());

        assertThat(detector.detect(context(nodes)).detected()).isFalse();
    }
}
