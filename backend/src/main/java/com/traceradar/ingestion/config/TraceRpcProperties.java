package com.traceradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Trace RPC endpoints, throttling and transport retry settings.
 */
@ConfigurationProperties(prefix = "traceradar.rpc")
@NoArgsConstructor
@Getter
@Setter
public class TraceRpcProperties {

    /** Archive/tracing node URLs, used round-robin. */
    private List<String> urls = new ArrayList<>(List.of("https://eth.llamarpc.com"));

    /** Local RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 25;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 2_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    /** Per-request HTTP timeout. */
    private long requestTimeoutMs = 30_000;

    /** Largest JSON-RPC response body buffered in memory. */
    private int maxResponseBytes = 16 * 1024 * 1024;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        private long baseDelayMs = 500;

        private double jitterFactor = 0.2;

        private int maxAttempts = 3;
    }
}
