package com.traceradar.analysis;

/**
 * BASIC skips the advanced MEV detectors; FULL runs every stage.
 */
public enum AnalysisDepth {
    BASIC,
    FULL
}
