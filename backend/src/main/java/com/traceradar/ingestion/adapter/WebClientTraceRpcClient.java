package com.traceradar.ingestion.adapter;

import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Trace JSON-RPC client on WebClient. Trace responses for large transactions run to megabytes, so the codec buffer
 * limit is raised to {@code maxResponseBytes}; a larger body fails the call.
 */
public class WebClientTraceRpcClient implements TraceRpcClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final int maxResponseBytes;

    public WebClientTraceRpcClient(WebClient.Builder builder, Duration timeout, int maxResponseBytes) {
        this.webClient = builder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxResponseBytes))
                .build();
        this.timeout = timeout;
        this.maxResponseBytes = maxResponseBytes;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientTraceRpcClient::exceedsBufferLimit,
                        e -> new RpcException(method + " response exceeded " + maxResponseBytes + " bytes on " + endpointUrl, e))
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException(method + " timed out after " + timeout.toMillis() + " ms on " + endpointUrl, e));
    }

    private static boolean exceedsBufferLimit(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof DataBufferLimitException) {
                return true;
            }
        }
        return false;
    }
}
