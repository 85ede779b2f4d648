package com.traceradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Protocol name by contract address, added on top of the built-in registry entries.
 * See application.yml traceradar.protocol-registry.
 */
@ConfigurationProperties(prefix = "traceradar.protocol-registry")
@NoArgsConstructor
@Getter
@Setter
public class ProtocolRegistryProperties {

    /**
     * Map: address (0x…) -> protocol display name (e.g. "Uniswap V3").
     */
    private Map<String, String> names = new HashMap<>();
}
