package com.traceradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Source of raw call traces for a transaction.
 */
public interface TraceProvider {

    /**
     * Fetch the ordered trace items of a transaction.
     *
     * @throws TraceNotFoundException when the node has no trace for the hash
     * @throws RpcException           on transport failure or a malformed response
     */
    List<JsonNode> fetchTrace(String txHash);
}
