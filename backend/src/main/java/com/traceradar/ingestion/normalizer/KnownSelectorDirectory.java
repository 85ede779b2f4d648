package com.traceradar.ingestion.normalizer;

import java.util.Map;
import java.util.Optional;

/**
 * Names of widely used DEX and lending entry points, so calls to untracked contracts still show what kind of
 * interaction they are. Only the name is resolved; arguments of untracked calls are never decoded.
 */
final class KnownSelectorDirectory {

    private static final Map<String, String> NAMES = Map.ofEntries(
            Map.entry("0x38ed1739", "swapExactTokensForTokens"),
            Map.entry("0x8803dbee", "swapTokensForExactTokens"),
            Map.entry("0x7ff36ab5", "swapExactETHForTokens"),
            Map.entry("0x18cbafe5", "swapExactTokensForETH"),
            Map.entry("0x414bf389", "exactInputSingle"),
            Map.entry("0x04e45aaf", "exactInputSingle"),
            Map.entry("0xc04b8d59", "exactInput"),
            Map.entry("0x022c0d9f", "swap"),
            Map.entry("0x128acb08", "swap"),
            Map.entry("0x52bbbe29", "swap"),
            Map.entry("0x3df02124", "exchange"),
            Map.entry("0xa6417ed6", "exchange_underlying"),
            Map.entry("0xe8e33700", "addLiquidity"),
            Map.entry("0xbaa2abde", "removeLiquidity"),
            Map.entry("0xab9c4b5d", "flashLoan"),
            Map.entry("0x42b0b77c", "flashLoanSimple"),
            Map.entry("0x5cffe9de", "flashLoan"),
            Map.entry("0x00a718a9", "liquidationCall"),
            Map.entry("0xf5e3c462", "liquidateBorrow"),
            Map.entry("0xb2a02ff1", "seize"),
            Map.entry("0xc5ebeaec", "borrow"),
            Map.entry("0xa415bcad", "borrow"),
            Map.entry("0x0e752702", "repayBorrow"),
            Map.entry("0x573ade81", "repay"),
            Map.entry("0xd0e30db0", "deposit"),
            Map.entry("0x2e1a7d4d", "withdraw")
    );

    private KnownSelectorDirectory() {
    }

    static Optional<String> lookup(String selector) {
        if (selector == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(NAMES.get(selector.toLowerCase()));
    }
}
