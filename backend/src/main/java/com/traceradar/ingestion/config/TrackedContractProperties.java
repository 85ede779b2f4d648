package com.traceradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contracts whose calls are fully decoded. Key = address, value = display name.
 * See application.yml traceradar.tracked.
 */
@ConfigurationProperties(prefix = "traceradar.tracked")
@NoArgsConstructor
@Getter
@Setter
public class TrackedContractProperties {

    private Map<String, String> contracts = new LinkedHashMap<>();

    private String tokenSymbol = "PYUSD";

    private int tokenDecimals = 6;
}
