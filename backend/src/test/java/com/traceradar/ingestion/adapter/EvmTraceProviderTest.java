package com.traceradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traceradar.common.RetryPolicy;
import com.traceradar.ingestion.config.TraceRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmTraceProviderTest {

    private static final String TX = "0x" + "ab".repeat(32);

    @Test
    void fetchTrace_resultArray_returnsItemsInOrder() {
        String json = """
                {"jsonrpc":"2.0","id":1,"result":[
                  {"type":"call","action":{"from":"0x1","to":"0x2","value":"0x0","input":"0x"},"result":{"gasUsed":"0x5208","output":"0x"},"traceAddress":[]},
                  {"type":"call","action":{"from":"0x2","to":"0x3","value":"0x0","input":"0x"},"result":{"gasUsed":"0x100","output":"0x"},"traceAddress":[0]}
                ]}
                """;
        List<String> methods = new ArrayList<>();
        TraceRpcClient client = (endpoint, method, params) -> {
            methods.add(method);
            return Mono.just(json);
        };

        List<JsonNode> items = provider(client, "https://trace.io").fetchTrace(TX);

        assertThat(items).hasSize(2);
        assertThat(items.get(1).path("action").path("to").asText()).isEqualTo("0x3");
        assertThat(methods).containsExactly("trace_transaction");
    }

    @Test
    void fetchTrace_nullResult_throwsNotFoundWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        TraceRpcClient client = (endpoint, method, params) -> {
            calls.incrementAndGet();
            return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}");
        };

        assertThatThrownBy(() -> provider(client, "https://trace.io").fetchTrace(TX))
                .isInstanceOf(TraceNotFoundException.class)
                .hasMessageContaining(TX);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void fetchTrace_rpcError_retriesAcrossEndpointsThenFails() {
        List<String> endpoints = new ArrayList<>();
        TraceRpcClient client = (endpoint, method, params) -> {
            endpoints.add(endpoint);
            return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"method not found\"}}");
        };

        assertThatThrownBy(() -> provider(client, "https://a.io", "https://b.io").fetchTrace(TX))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("after 3 attempts")
                .hasMessageContaining("method not found");
        assertThat(endpoints).containsExactly("https://a.io", "https://b.io", "https://a.io");
    }

    @Test
    void fetchTrace_transientFailure_recoversOnNextAttempt() {
        AtomicInteger calls = new AtomicInteger();
        TraceRpcClient client = (endpoint, method, params) -> {
            if (calls.getAndIncrement() == 0) {
                return Mono.error(new RpcException("HTTP 503"));
            }
            return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[]}");
        };

        assertThat(provider(client, "https://trace.io").fetchTrace(TX)).isEmpty();
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void fetchTrace_resultNotArray_throwsRpcException() {
        TraceRpcClient client = (endpoint, method, params) -> Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}");

        assertThatThrownBy(() -> provider(client, "https://trace.io").fetchTrace(TX))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("expected array");
    }

    private static EvmTraceProvider provider(TraceRpcClient client, String... urls) {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of(urls), new RetryPolicy(0L, 0, 3));
        return new EvmTraceProvider(client, rotator, fastLimiter(), new TraceRpcProperties(), new ObjectMapper());
    }

    private static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-trace-fast-limiter", config);
    }
}
