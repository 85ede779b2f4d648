package com.traceradar.ingestion.adapter;

/**
 * Thrown when a trace RPC call fails (HTTP, JSON-RPC error or unexpected payload).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
