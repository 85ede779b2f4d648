package com.traceradar.ingestion.normalizer;

import com.traceradar.ingestion.config.ProtocolRegistryProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-based protocol registry: built-in mainnet DEX/lending addresses plus configured names (configured wins).
 */
@Component
public class DefaultProtocolRegistry implements ProtocolRegistry {

    private final Map<String, String> nameByAddress = new ConcurrentHashMap<>();

    public DefaultProtocolRegistry(ProtocolRegistryProperties properties) {
        nameByAddress.put("0x7a250d5630b4cf539739df2c5dacb4c659f2488d", "Uniswap V2 Router");
        nameByAddress.put("0xe592427a0aece92de3edee1f18e0157c05861564", "Uniswap V3 Router");
        nameByAddress.put("0x68b3465833fb72a70ecdf485e0e4c7bd8665fc45", "Uniswap V3 Router 2");
        nameByAddress.put("0xd9e1ce17f2641f24ae83637ab66a2cca9c378b9f", "SushiSwap Router");
        nameByAddress.put("0xba12222222228d8ba445958a75a0704d566bf2c8", "Balancer Vault");
        nameByAddress.put("0xbebc44782c7db0a1a60cb6fe97d0b483032ff1c7", "Curve 3pool");
        nameByAddress.put("0x7d2768de32b0b80b7a3454c06bdac94a69ddc7a9", "Aave V2 Lending Pool");
        nameByAddress.put("0x87870bca3f3fd6335c3f4ce8392d69350b4fa4e2", "Aave V3 Pool");
        if (properties != null && properties.getNames() != null) {
            properties.getNames().forEach((address, name) -> {
                if (address != null && !address.isBlank() && name != null) {
                    nameByAddress.put(address.strip().toLowerCase(), name);
                }
            });
        }
    }

    @Override
    public Optional<String> getProtocolName(String address) {
        if (address == null || address.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nameByAddress.get(address.strip().toLowerCase()));
    }
}
