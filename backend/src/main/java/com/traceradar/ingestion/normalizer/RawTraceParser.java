package com.traceradar.ingestion.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.traceradar.domain.RawCallRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads one Parity-style trace item ({@code {type, action, result, traceAddress, error}}) into a RawCallRecord.
 */
final class RawTraceParser {

    private RawTraceParser() {
    }

    /**
     * Empty when the item is not a JSON object.
     */
    static Optional<RawCallRecord> parse(JsonNode item) {
        if (item == null || !item.isObject()) {
            return Optional.empty();
        }
        JsonNode action = item.path("action");
        JsonNode result = item.path("result");
        String type = text(item.path("type"));
        String callType = type == null || type.isBlank() ? "UNKNOWN" : type.strip().toUpperCase();

        String from = text(action.path("from"));
        String to = text(action.path("to"));
        String value = text(action.path("value"));
        if (FunctionDecoder.DESTRUCT_KINDS.contains(callType)) {
            from = firstNonBlank(text(action.path("address")), from);
            to = firstNonBlank(text(action.path("refundAddress")), to);
            value = firstNonBlank(text(action.path("balance")), value);
        }
        String input = firstNonBlank(text(action.path("input")), text(action.path("init")));
        String output = firstNonBlank(text(result.path("output")), text(result.path("code")));
        String gasUsed = firstNonBlank(text(result.path("gasUsed")), text(item.path("gasUsed")));

        return Optional.of(new RawCallRecord(
                callType,
                from,
                to,
                text(result.path("address")),
                value,
                input,
                output,
                gasUsed,
                traceAddress(item.path("traceAddress")),
                text(item.path("error"))));
    }

    private static List<Integer> traceAddress(JsonNode node) {
        List<Integer> path = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> path.add(n.asInt()));
        }
        return path;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static String firstNonBlank(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }
}
