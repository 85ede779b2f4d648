package com.traceradar.api.dto;

import com.traceradar.api.validation.TransactionHash;

/**
 * Query parameters of GET /traces/compare.
 */
public record CompareRequest(@TransactionHash String base, @TransactionHash String target) {
}
