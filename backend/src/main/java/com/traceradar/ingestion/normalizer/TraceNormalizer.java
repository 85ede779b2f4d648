package com.traceradar.ingestion.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.traceradar.common.HexValues;
import com.traceradar.common.TokenAmounts;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.RawCallRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw trace items into ProcessedCallNodes, keeping input order. Malformed items are skipped and counted,
 * never fatal; unparseable hex decodes to zero.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TraceNormalizer {

    static final String OTHER_CONTRACT = "Other Contract";
    private static final int PREVIEW_LENGTH = 10;

    private final TrackedContractRegistry trackedContracts;
    private final ProtocolRegistry protocolRegistry;
    private final FunctionDecoder functionDecoder;

    public NormalizationResult normalize(List<JsonNode> items) {
        if (items == null || items.isEmpty()) {
            return new NormalizationResult(List.of(), 0);
        }
        List<ProcessedCallNode> nodes = new ArrayList<>(items.size());
        int skipped = 0;
        for (int i = 0; i < items.size(); i++) {
            Optional<RawCallRecord> record = RawTraceParser.parse(items.get(i));
            if (record.isEmpty()) {
                skipped++;
                log.warn("Skipping trace item {}: not a JSON object", i);
                continue;
            }
            nodes.add(toNode(i, record.get()));
        }
        return new NormalizationResult(nodes, skipped);
    }

    /**
     * Normalizes already-parsed records; the index of each node is its position in the list.
     */
    public List<ProcessedCallNode> normalizeRecords(List<RawCallRecord> records) {
        List<ProcessedCallNode> nodes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            nodes.add(toNode(i, records.get(i)));
        }
        return nodes;
    }

    ProcessedCallNode toNode(int index, RawCallRecord raw) {
        String callType = raw.callType() == null || raw.callType().isBlank() ? "UNKNOWN" : raw.callType().toUpperCase();
        String from = raw.from() != null ? raw.from() : "";
        String to = raw.to() != null && !raw.to().isBlank() ? raw.to() : (raw.createdAddress() != null ? raw.createdAddress() : "");
        Optional<String> trackedName = trackedContracts.getContractName(to);
        boolean tracked = trackedName.isPresent();
        String contractName = trackedName
                .or(() -> protocolRegistry.getProtocolName(to))
                .orElse(OTHER_CONTRACT);
        DecodedFunction decoded = functionDecoder.decode(callType, raw.input(), tracked);
        BigInteger valueWei = HexValues.toBigInteger(raw.value());

        return new ProcessedCallNode(
                index,
                raw.traceAddress(),
                callType,
                raw.traceAddress().size(),
                from,
                to,
                valueWei,
                TokenAmounts.scale(valueWei, TokenAmounts.NATIVE_DECIMALS),
                HexValues.toLong(raw.gasUsed()),
                tracked,
                contractName,
                decoded.name(),
                decoded.category(),
                decoded.parameters(),
                HexValues.selector(raw.input()),
                HexValues.preview(raw.input(), PREVIEW_LENGTH),
                HexValues.preview(raw.output(), PREVIEW_LENGTH),
                raw.error() != null && !raw.error().isBlank() ? raw.error() : null);
    }
}
