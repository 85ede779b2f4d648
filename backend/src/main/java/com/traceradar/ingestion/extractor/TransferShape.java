package com.traceradar.ingestion.extractor;

import com.traceradar.domain.FunctionParameters;
import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TransferKind;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Field-to-role mapping for each transfer-shaped selector.
 */
enum TransferShape {

    TRANSFER("0xa9059cbb", TransferKind.TRANSFER, (node, p) -> node.from(), (node, p) -> p.to()),
    TRANSFER_FROM("0x23b872dd", TransferKind.TRANSFER_FROM, (node, p) -> p.from(), (node, p) -> p.to()),
    MINT("0x40c10f19", TransferKind.MINT, (node, p) -> KnownFunctions.ZERO_ADDRESS, (node, p) -> p.to()),
    BURN("0x42966c68", TransferKind.BURN, (node, p) -> node.from(), (node, p) -> KnownFunctions.ZERO_ADDRESS);

    private final String selector;
    private final TransferKind kind;
    private final BiFunction<ProcessedCallNode, FunctionParameters, String> sender;
    private final BiFunction<ProcessedCallNode, FunctionParameters, String> recipient;

    TransferShape(String selector,
                  TransferKind kind,
                  BiFunction<ProcessedCallNode, FunctionParameters, String> sender,
                  BiFunction<ProcessedCallNode, FunctionParameters, String> recipient) {
        this.selector = selector;
        this.kind = kind;
        this.sender = sender;
        this.recipient = recipient;
    }

    static Optional<TransferShape> forSelector(String selector) {
        if (selector == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(s -> s.selector.equalsIgnoreCase(selector)).findFirst();
    }

    TransferKind kind() {
        return kind;
    }

    String sender(ProcessedCallNode node) {
        return sender.apply(node, node.parameters());
    }

    String recipient(ProcessedCallNode node) {
        return recipient.apply(node, node.parameters());
    }
}
