package com.traceradar.analysis.security;

import com.traceradar.domain.RiskLevel;

/**
 * @param contract contract name of the offending call
 * @param caller   {@code from} address of the offending call
 */
public record SecurityConcern(RiskLevel level, String description, String contract, String caller) {
}
