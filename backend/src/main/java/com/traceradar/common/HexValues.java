package com.traceradar.common;

import java.math.BigInteger;

/**
 * Lenient hex decoding for trace fields. Malformed input never raises: it decodes to zero (or null for addresses).
 */
public final class HexValues {

    /** One ABI word is 32 bytes = 64 hex chars. */
    public static final int WORD_HEX_LENGTH = 64;

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private HexValues() {
    }

    /**
     * Hex string ("0x1a", "1a", "0x") to non-negative BigInteger; missing or malformed = ZERO.
     */
    public static BigInteger toBigInteger(String hex) {
        String digits = stripPrefix(hex);
        if (digits == null || digits.isEmpty() || digits.charAt(0) == '-' || digits.charAt(0) == '+') {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            return BigInteger.ZERO;
        }
    }

    /**
     * Same as {@link #toBigInteger(String)} but clamped to long; values beyond long range decode to 0.
     */
    public static long toLong(String hex) {
        BigInteger value = toBigInteger(hex);
        if (value.signum() < 0 || value.compareTo(LONG_MAX) > 0) {
            return 0L;
        }
        return value.longValue();
    }

    /**
     * Hex digits without "0x" prefix, or null if input is null.
     */
    public static String stripPrefix(String hex) {
        if (hex == null) {
            return null;
        }
        String s = hex.strip();
        if (s.startsWith("0x") || s.startsWith("0X")) {
            return s.substring(2);
        }
        return s;
    }

    /**
     * Four-byte selector ("0xa9059cbb") of calldata, lowercased; null when the data is shorter than a selector.
     */
    public static String selector(String calldata) {
        String digits = stripPrefix(calldata);
        if (digits == null || digits.length() < 8) {
            return null;
        }
        return "0x" + digits.substring(0, 8).toLowerCase();
    }

    /**
     * Number of complete 32-byte argument words after the selector.
     */
    public static int argumentWordCount(String calldata) {
        String digits = stripPrefix(calldata);
        if (digits == null || digits.length() <= 8) {
            return 0;
        }
        return (digits.length() - 8) / WORD_HEX_LENGTH;
    }

    /**
     * Zero-based argument word after the selector, or null when the calldata is too short.
     */
    public static String argumentWord(String calldata, int index) {
        String digits = stripPrefix(calldata);
        if (digits == null) {
            return null;
        }
        int start = 8 + index * WORD_HEX_LENGTH;
        int end = start + WORD_HEX_LENGTH;
        if (index < 0 || digits.length() < end) {
            return null;
        }
        return digits.substring(start, end);
    }

    /**
     * Address held in the low 20 bytes of a word, as lowercase "0x" + 40 hex.
     */
    public static String wordToAddress(String word) {
        if (word == null || word.length() < 40) {
            return null;
        }
        return "0x" + word.substring(word.length() - 40).toLowerCase();
    }

    /**
     * Text preview: first {@code length} chars plus "..." when longer.
     */
    public static String preview(String value, int length) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        if (value.length() <= length) {
            return value;
        }
        return value.substring(0, length) + "...";
    }
}
