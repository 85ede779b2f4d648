package com.traceradar.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceradar.ingestion.config.TraceRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fetches call traces with {@code trace_transaction}. Rotates endpoints and retries transport failures with
 * backoff; a missing trace is reported at once without retrying.
 */
@Slf4j
@Component
public class EvmTraceProvider implements TraceProvider {

    static final String TRACE_METHOD = "trace_transaction";

    private final TraceRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final TraceRpcProperties properties;
    private final ObjectMapper objectMapper;

    public EvmTraceProvider(
            TraceRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier("traceRpcRateLimiter") RateLimiter rateLimiter,
            TraceRpcProperties properties,
            ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<JsonNode> fetchTrace(String txHash) {
        RpcException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(attempt);
            }
            String endpoint = rotator.getNextEndpoint();
            try {
                String json = callRpc(endpoint, txHash);
                List<JsonNode> items = parseTrace(json, txHash);
                log.debug("Fetched {} trace items for {} from {}", items.size(), txHash, endpoint);
                return items;
            } catch (RpcException e) {
                lastException = e;
                log.warn("{} attempt {}/{} failed on {} for {}: {}",
                        TRACE_METHOD, attempt + 1, rotator.getMaxAttempts(), endpoint, txHash, e.getMessage());
            }
        }
        String msg = "Trace fetch failed after " + rotator.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null && !lastException.getMessage().isBlank()) {
            msg += ": " + lastException.getMessage();
        }
        throw new RpcException(msg, lastException);
    }

    private void sleepBeforeRetry(int attempt) {
        try {
            Thread.sleep(rotator.retryDelayMs(attempt - 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }

    private String callRpc(String endpoint, String txHash) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + TRACE_METHOD + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, properties.getLocalLimiterLogThresholdMs())) {
            log.info("Local trace RPC limiter delayed {} ms before {} on {}", waitedMs, TRACE_METHOD, endpoint);
        }
        String body = rpcClient.call(endpoint, TRACE_METHOD, Collections.singletonList(txHash)).block();
        if (body == null || body.isBlank()) {
            throw new RpcException("Empty response for " + TRACE_METHOD + " on " + endpoint);
        }
        return body;
    }

    private List<JsonNode> parseTrace(String json, String txHash) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + TRACE_METHOD + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(TRACE_METHOD + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new TraceNotFoundException(txHash);
        }
        if (!result.isArray()) {
            throw new RpcException("Invalid trace data received from RPC: expected array but got " + result.getNodeType());
        }
        List<JsonNode> items = new ArrayList<>(result.size());
        result.forEach(items::add);
        return items;
    }
}
