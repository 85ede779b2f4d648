package com.traceradar.analysis.mev;

import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RiskLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.traceradar.analysis.mev.MevFixtures.context;
import static com.traceradar.analysis.mev.MevFixtures.sushiswap;
import static com.traceradar.analysis.mev.MevFixtures.uniswap;
import static com.traceradar.fixtures.CallNodeBuilder.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SandwichDetectorTest {

    private final SandwichDetector detector = new SandwichDetector();

    @Test
    void detect_deepHighValueSwaps_firesHighPattern() {
        List<ProcessedCallNode> nodes = List.of(
                call().build(),
                uniswap().valueEther(15).at(0, 0, 0, 0).build(),
                sushiswap().at(0, 0, 0, 1).build(),
                uniswap().at(0, 0, 0, 2).build());

        MevDetection detection = detector.detect(context(nodes));

        assertThat(detection.indicators()).extracting(MevIndicator::type)
                .containsExactly("high_price_impact", "unusual_slippage");
        MevPattern pattern = detection.pattern();
        assertThat(pattern.severity()).isEqualTo(RiskLevel.HIGH);
        assertThat(pattern.confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(pattern.extractedValue()).isEqualByComparingTo(new BigDecimal("15"));
    }

    @Test
    void detect_botSignature_needsManyDeepCallsAndCheapCall() {
        List<ProcessedCallNode> nodes = new ArrayList<>(List.of(
                uniswap().at(0, 0, 0, 0).build(),
                sushiswap().at(0, 0, 0, 1).build()));
        for (int i = 2; i < 6; i++) {
            nodes.add(call().at(0, 0, 0, i).build());
        }
        nodes.add(call().at(1).gas(2_300).build());

        MevDetection detection = detector.detect(context(nodes));

        assertThat(detection.indicators()).extracting(MevIndicator::type).containsExactly("mev_bot_signature");
        assertThat(detection.detected()).isFalse();
    }

    @Test
    void detect_shallowTrace_none() {
        List<ProcessedCallNode> nodes = List.of(
                uniswap().valueEther(50).at(0, 0, 0).build(),
                sushiswap().at(0, 0, 1).build(),
                uniswap().at(0, 0, 2).build());

        assertThat(detector.detect(context(nodes)).indicators()).isEmpty();
    }
}
