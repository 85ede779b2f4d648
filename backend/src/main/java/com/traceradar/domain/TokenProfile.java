package com.traceradar.domain;

/**
 * Symbol and decimals of the tracked token, used to scale raw amounts.
 */
public record TokenProfile(String symbol, int decimals) {

    public static TokenProfile pyusd() {
        return new TokenProfile("PYUSD", 6);
    }
}
