package com.traceradar.analysis.security;

import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.RiskLevel;

import java.util.Map;
import java.util.Optional;

/**
 * Static risk level of administrative functions, matched on the exact decoded function name.
 */
public final class SecurityRiskTable {

    static final Map<String, RiskLevel> LEVELS = Map.ofEntries(
            Map.entry(KnownFunctions.TRANSFER_OWNERSHIP, RiskLevel.HIGH),
            Map.entry(KnownFunctions.PAUSE, RiskLevel.MEDIUM),
            Map.entry(KnownFunctions.UNPAUSE, RiskLevel.MEDIUM),
            Map.entry("blacklist", RiskLevel.MEDIUM),
            Map.entry("upgrade", RiskLevel.HIGH),
            Map.entry("initialize", RiskLevel.HIGH),
            Map.entry(KnownFunctions.SELFDESTRUCT, RiskLevel.CRITICAL),
            Map.entry(KnownFunctions.MINT, RiskLevel.HIGH),
            Map.entry(KnownFunctions.BURN, RiskLevel.MEDIUM),
            Map.entry("renounceOwnership()", RiskLevel.HIGH)
    );

    private SecurityRiskTable() {
    }

    public static Optional<RiskLevel> lookup(String functionName) {
        if (functionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(LEVELS.get(functionName));
    }
}
