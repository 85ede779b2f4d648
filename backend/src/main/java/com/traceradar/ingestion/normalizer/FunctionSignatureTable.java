package com.traceradar.ingestion.normalizer;

import com.traceradar.domain.FunctionCategory;
import com.traceradar.domain.KnownFunctions;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.traceradar.ingestion.normalizer.FunctionSignature.address;
import static com.traceradar.ingestion.normalizer.FunctionSignature.uint;

/**
 * Selector-indexed decode table for tracked contracts.
 */
final class FunctionSignatureTable {

    static final List<FunctionSignature> SIGNATURES = List.of(
            new FunctionSignature("0xa9059cbb", KnownFunctions.TRANSFER, FunctionCategory.TOKEN_MOVEMENT,
                    List.of(address("to"), uint("amount"))),
            new FunctionSignature("0x23b872dd", KnownFunctions.TRANSFER_FROM, FunctionCategory.TOKEN_MOVEMENT,
                    List.of(address("from"), address("to"), uint("amount"))),
            new FunctionSignature("0x095ea7b3", KnownFunctions.APPROVE, FunctionCategory.ALLOWANCE,
                    List.of(address("spender"), uint("amount"))),
            new FunctionSignature("0xdd62ed3e", "allowance(address,address)", FunctionCategory.VIEW,
                    List.of(address("owner"), address("spender"))),
            new FunctionSignature("0x40c10f19", KnownFunctions.MINT, FunctionCategory.SUPPLY_CHANGE,
                    List.of(address("to"), uint("amount"))),
            new FunctionSignature("0x42966c68", KnownFunctions.BURN, FunctionCategory.SUPPLY_CHANGE,
                    List.of(uint("amount"))),
            new FunctionSignature("0x70a08231", "balanceOf(address)", FunctionCategory.VIEW,
                    List.of(address("account"))),
            new FunctionSignature("0x18160ddd", "totalSupply()", FunctionCategory.VIEW, List.of()),
            new FunctionSignature("0xf2fde38b", KnownFunctions.TRANSFER_OWNERSHIP, FunctionCategory.ADMIN,
                    List.of(address("newOwner"))),
            new FunctionSignature("0x8da5cb5b", "owner()", FunctionCategory.VIEW, List.of()),
            new FunctionSignature("0x8456cb59", KnownFunctions.PAUSE, FunctionCategory.CONTROL, List.of()),
            new FunctionSignature("0x3f4ba83a", KnownFunctions.UNPAUSE, FunctionCategory.CONTROL, List.of())
    );

    private static final Map<String, FunctionSignature> BY_SELECTOR = SIGNATURES.stream()
            .collect(Collectors.toUnmodifiableMap(FunctionSignature::selector, Function.identity()));

    private FunctionSignatureTable() {
    }

    static Optional<FunctionSignature> lookup(String selector) {
        if (selector == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SELECTOR.get(selector.toLowerCase()));
    }
}
