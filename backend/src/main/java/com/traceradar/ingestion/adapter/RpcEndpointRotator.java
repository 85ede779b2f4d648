package com.traceradar.ingestion.adapter;

import com.traceradar.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin selection over trace RPC endpoints with the retry delay of the configured policy.
 */
public class RpcEndpointRotator {

    private final List<String> endpoints;
    private final AtomicInteger index;
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        this.endpoints = List.copyOf(endpoints);
        this.index = new AtomicInteger(0);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public String getNextEndpoint() {
        int i = Math.floorMod(index.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }
}
