package com.traceradar.ingestion.config;

import com.traceradar.common.RetryPolicy;
import com.traceradar.domain.TokenProfile;
import com.traceradar.ingestion.adapter.RpcEndpointRotator;
import com.traceradar.ingestion.adapter.TraceRpcClient;
import com.traceradar.ingestion.adapter.WebClientTraceRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Trace RPC transport: endpoint rotator, WebClient JSON-RPC client and local rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ TraceRpcProperties.class, TrackedContractProperties.class, ProtocolRegistryProperties.class })
public class IngestionAdapterConfig {

    /** Used when traceradar.rpc.urls is empty so the provider can still start. */
    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("https://eth.llamarpc.com");

    @Bean
    public RpcEndpointRotator traceRpcEndpointRotator(TraceRpcProperties properties) {
        TraceRpcProperties.Retry retry = properties.getRetry();
        RetryPolicy policy = new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
        List<String> urls = properties.getUrls() == null || properties.getUrls().isEmpty()
                ? DEFAULT_FALLBACK_URLS
                : properties.getUrls();
        return new RpcEndpointRotator(urls, policy);
    }

    @Bean
    public TraceRpcClient traceRpcClient(WebClient.Builder webClientBuilder, TraceRpcProperties properties) {
        return new WebClientTraceRpcClient(webClientBuilder.clone(),
                Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())),
                Math.max(1, properties.getMaxResponseBytes()));
    }

    @Bean(name = "traceRpcRateLimiter")
    public RateLimiter traceRpcRateLimiter(TraceRpcProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("trace-rpc", config);
    }

    @Bean
    public TokenProfile trackedTokenProfile(TrackedContractProperties properties) {
        return new TokenProfile(properties.getTokenSymbol(), properties.getTokenDecimals());
    }
}
