package com.traceradar.ingestion.normalizer;

import java.util.Optional;

/**
 * The small fixed set of contracts whose calls are decoded with the full signature table.
 */
public interface TrackedContractRegistry {

    /**
     * Display name of a tracked contract, empty when the address is not tracked.
     */
    Optional<String> getContractName(String address);

    default boolean isTracked(String address) {
        return getContractName(address).isPresent();
    }
}
