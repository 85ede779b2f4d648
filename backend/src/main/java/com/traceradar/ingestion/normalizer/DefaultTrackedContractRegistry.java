package com.traceradar.ingestion.normalizer;

import com.traceradar.ingestion.config.TrackedContractProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Tracked contracts keyed by lower-case address. Falls back to the PYUSD deployment when none are configured.
 */
@Slf4j
@Component
public class DefaultTrackedContractRegistry implements TrackedContractRegistry {

    static final Map<String, String> PYUSD_CONTRACTS = Map.of(
            "0x6c3ea9036406852006290770bedfcaba0e23a0e8", "PYUSD Token",
            "0x8ecae0b0402e29694b3af35d5943d4631ee568dc", "PYUSD Implementation",
            "0x31d9bdea6f104606c954f8fe6ba614f1bd347ec3", "Supply Control",
            "0x123456789abcdef123456789abcdef123456789a", "Supply Control Impl"
    );

    private final Map<String, String> nameByAddress;

    public DefaultTrackedContractRegistry(TrackedContractProperties properties) {
        Map<String, String> configured = properties != null ? properties.getContracts() : null;
        Map<String, String> source = configured == null || configured.isEmpty() ? PYUSD_CONTRACTS : configured;
        Map<String, String> normalized = new LinkedHashMap<>();
        source.forEach((address, name) -> {
            if (address != null && !address.isBlank()) {
                normalized.put(address.strip().toLowerCase(), name);
            }
        });
        this.nameByAddress = Map.copyOf(normalized);
        log.info("Tracking {} contracts", nameByAddress.size());
    }

    @Override
    public Optional<String> getContractName(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nameByAddress.get(address.strip().toLowerCase()));
    }
}
