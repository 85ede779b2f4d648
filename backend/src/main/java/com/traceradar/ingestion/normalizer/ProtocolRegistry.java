package com.traceradar.ingestion.normalizer;

import java.util.Optional;

/**
 * Known protocol name by contract address (e.g. a DEX router or lending pool).
 */
public interface ProtocolRegistry {

    Optional<String> getProtocolName(String address);
}
