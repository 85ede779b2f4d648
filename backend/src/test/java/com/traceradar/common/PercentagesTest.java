package com.traceradar.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PercentagesTest {

    @Test
    void of_zeroTotal_isZero() {
        assertThat(Percentages.of(5, 0)).isZero();
        assertThat(Percentages.of(25, 200)).isEqualTo(12.5);
    }

    @Test
    void change_zeroBaseline_isHundredUnlessBothZero() {
        assertThat(Percentages.change(0, 0)).isZero();
        assertThat(Percentages.change(0, 10)).isEqualTo(100.0);
        assertThat(Percentages.change(100_000, 160_000)).isEqualTo(60.0);
        assertThat(Percentages.change(200, 100)).isEqualTo(-50.0);
    }

    @Test
    void round2_roundsToTwoDecimals() {
        assertThat(Percentages.round2(33.33333)).isEqualTo(33.33);
        assertThat(Percentages.round2(0.125)).isEqualTo(0.13);
    }
}
