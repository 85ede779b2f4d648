package com.traceradar.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TransactionHashesTest {

    @Test
    void isValid_requiresPrefixAnd64HexChars() {
        assertThat(TransactionHashes.isValid("0x" + "aB".repeat(32))).isTrue();
        assertThat(TransactionHashes.isValid("aB".repeat(32))).isFalse();
        assertThat(TransactionHashes.isValid("0x" + "a".repeat(63))).isFalse();
        assertThat(TransactionHashes.isValid("0x" + "g".repeat(64))).isFalse();
        assertThat(TransactionHashes.isValid(null)).isFalse();
    }
}
