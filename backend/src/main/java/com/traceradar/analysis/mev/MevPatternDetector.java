package com.traceradar.analysis.mev;

/**
 * One specialised advanced-tier detector. Implementations are independent of each other.
 */
public interface MevPatternDetector {

    MevPatternType type();

    MevDetection detect(MevContext context);
}
