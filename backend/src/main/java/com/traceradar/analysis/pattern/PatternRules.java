package com.traceradar.analysis.pattern;

import com.traceradar.domain.GasThresholds;
import com.traceradar.domain.KnownFunctions;

import java.util.List;

/**
 * Classification rules in declaration order; equal confidences keep this order.
 */
public final class PatternRules {

    public static final List<PatternRule> DEFAULT = List.of(
            new PatternRule(PatternType.SIMPLE_TRANSFER, 0.90, "Simple PYUSD transfer between addresses",
                    f -> f.transferCount() == 1 && f.distinctTrackedTargets() <= 1 && f.calls(KnownFunctions.TRANSFER) == 1),
            new PatternRule(PatternType.MULTI_TRANSFER, 0.80, "Multiple PYUSD transfers in one transaction",
                    f -> f.transferCount() > 1 && f.calls(KnownFunctions.TRANSFER) > 1),
            new PatternRule(PatternType.APPROVAL_FLOW, 0.85, "PYUSD approval for future spending",
                    f -> f.calls(KnownFunctions.APPROVE) >= 1),
            new PatternRule(PatternType.SUPPLY_CHANGE, 0.95, "Minting or burning of PYUSD supply",
                    f -> f.calls(KnownFunctions.MINT) >= 1 || f.calls(KnownFunctions.BURN) >= 1),
            new PatternRule(PatternType.SWAP_OPERATION, 0.70, "PYUSD swap through DEX",
                    f -> f.transferCount() >= 1 && f.externalCalls() >= 3),
            new PatternRule(PatternType.LIQUIDITY_PROVISION, 0.60, "Adding/removing liquidity with PYUSD",
                    f -> f.transferCount() >= 1 && f.trackedMintLikeCalls() > 0),
            new PatternRule(PatternType.BRIDGE_OPERATION, 0.60, "PYUSD bridge operation (cross-chain)",
                    f -> f.transferCount() >= 1 && f.totalGas() > GasThresholds.HIGH)
    );

    private PatternRules() {
    }
}
