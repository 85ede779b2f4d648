package com.traceradar.ingestion.normalizer;

import com.traceradar.domain.ProcessedCallNode;

import java.util.List;

/**
 * Normalized nodes in original trace order plus the number of skipped malformed items.
 */
public record NormalizationResult(List<ProcessedCallNode> nodes, int skippedCount) {

    public NormalizationResult {
        nodes = List.copyOf(nodes);
    }
}
