package com.traceradar.analysis.mev;

public enum MevPatternType {
    SANDWICH_ATTACK,
    ARBITRAGE,
    FRONT_RUNNING,
    LIQUIDATION_MEV
}
