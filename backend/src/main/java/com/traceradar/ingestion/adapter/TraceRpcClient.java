package com.traceradar.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * JSON-RPC transport used by the trace provider. Retries and endpoint rotation live in the provider.
 */
public interface TraceRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "trace_transaction"
     * @param params      positional params
     * @return raw response body (JSON); errors on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
