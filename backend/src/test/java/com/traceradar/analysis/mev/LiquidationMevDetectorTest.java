package com.traceradar.analysis.mev;

import com.traceradar.domain.RiskLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.traceradar.analysis.mev.MevFixtures.context;
import static com.traceradar.analysis.mev.MevFixtures.flashLoan;
import static com.traceradar.fixtures.CallNodeBuilder.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LiquidationMevDetectorTest {

    private final LiquidationMevDetector detector = new LiquidationMevDetector();

    @Test
    void detect_flashLoanFundedLiquidation_firesBothIndicators() {
        MevDetection detection = detector.detect(context(List.of(
                flashLoan().build(),
                call().at(0).functionName("liquidateBorrow (0xf5e3c462)").valueEther(10).build())));

        assertThat(detection.indicators()).extracting(MevIndicator::type)
                .containsExactly("liquidation_bonus", "flash_loan_liquidation");
        assertThat(detection.pattern().severity()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(detection.pattern().confidence()).isCloseTo(0.85, within(1e-9));
        assertThat(detection.pattern().extractedValue()).isEqualByComparingTo(new BigDecimal("1.5"));
    }

    @Test
    void detect_seizeAlone_firesOnBonus() {
        MevDetection detection = detector.detect(context(List.of(call().functionName("seize (0xb2a02ff1)").build())));

        assertThat(detection.detected()).isTrue();
        assertThat(detection.indicators()).extracting(MevIndicator::type).containsExactly("liquidation_bonus");
    }

    @Test
    void detect_noLiquidationCall_none() {
        assertThat(detector.detect(context(List.of(flashLoan().build()))).detected()).isFalse();
    }
}
