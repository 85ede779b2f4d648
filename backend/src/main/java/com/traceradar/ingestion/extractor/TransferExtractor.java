package com.traceradar.ingestion.extractor;

import com.traceradar.common.TokenAmounts;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenProfile;
import com.traceradar.domain.TokenTransferEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts token movements (transfer, transferFrom, mint, burn) from tracked contract calls.
 * A call missing a decoded party or amount, or moving a zero amount, yields nothing.
 */
@Component
@RequiredArgsConstructor
public class TransferExtractor {

    private final TokenProfile tokenProfile;

    public List<TokenTransferEvent> extract(List<ProcessedCallNode> nodes) {
        List<TokenTransferEvent> transfers = new ArrayList<>();
        for (ProcessedCallNode node : nodes) {
            if (!node.tracked()) {
                continue;
            }
            Optional<TransferShape> shape = TransferShape.forSelector(node.selector());
            if (shape.isEmpty()) {
                continue;
            }
            BigInteger amount = node.parameters().amount();
            String from = shape.get().sender(node);
            String to = shape.get().recipient(node);
            if (amount == null || amount.signum() == 0 || isBlank(from) || isBlank(to)) {
                continue;
            }
            transfers.add(new TokenTransferEvent(
                    shape.get().kind(),
                    from,
                    to,
                    amount,
                    TokenAmounts.scale(amount, tokenProfile.decimals()),
                    node.traceAddress(),
                    node.index()));
        }
        return transfers;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
