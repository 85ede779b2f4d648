package com.traceradar.common;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HexValuesTest {

    @Test
    void toBigInteger_malformedOrMissing_isZero() {
        assertThat(HexValues.toBigInteger(null)).isEqualTo(BigInteger.ZERO);
        assertThat(HexValues.toBigInteger("0x")).isEqualTo(BigInteger.ZERO);
        assertThat(HexValues.toBigInteger("0xzz")).isEqualTo(BigInteger.ZERO);
        assertThat(HexValues.toBigInteger("0x1a")).isEqualTo(BigInteger.valueOf(26));
        assertThat(HexValues.toBigInteger("1A")).isEqualTo(BigInteger.valueOf(26));
    }

    @Test
    void toBigInteger_signedDigits_isZero() {
        assertThat(HexValues.toBigInteger("0x-1a")).isEqualTo(BigInteger.ZERO);
        assertThat(HexValues.toBigInteger("+1a")).isEqualTo(BigInteger.ZERO);
        assertThat(HexValues.toLong("0x-5208")).isZero();
    }

    @Test
    void toLong_beyondLongRange_isZero() {
        assertThat(HexValues.toLong("0x" + "f".repeat(20))).isZero();
        assertThat(HexValues.toLong("0x5208")).isEqualTo(21_000L);
    }

    @Test
    void selector_shortInput_isNull() {
        assertThat(HexValues.selector("0xa9059c")).isNull();
        assertThat(HexValues.selector("0xA9059CBB0000")).isEqualTo("0xa9059cbb");
    }

    @Test
    void argumentWord_readsWordsAfterSelector() {
        String data = "0xa9059cbb" + "0".repeat(24) + "b".repeat(40) + "0".repeat(62) + "ff";

        assertThat(HexValues.argumentWordCount(data)).isEqualTo(2);
        assertThat(HexValues.wordToAddress(HexValues.argumentWord(data, 0))).isEqualTo("0x" + "b".repeat(40));
        assertThat(HexValues.toBigInteger(HexValues.argumentWord(data, 1))).isEqualTo(BigInteger.valueOf(255));
        assertThat(HexValues.argumentWord(data, 2)).isNull();
    }

    @Test
    void preview_truncatesWithEllipsis() {
        assertThat(HexValues.preview("0xa9059cbb0000", 10)).isEqualTo("0xa9059cbb...");
        assertThat(HexValues.preview("0x", 10)).isEqualTo("0x");
        assertThat(HexValues.preview(null, 10)).isEmpty();
    }
}
