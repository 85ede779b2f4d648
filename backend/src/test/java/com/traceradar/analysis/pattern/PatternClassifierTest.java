package com.traceradar.analysis.pattern;

import com.traceradar.domain.KnownFunctions;
import com.traceradar.domain.ProcessedCallNode;
import com.traceradar.domain.TokenTransferEvent;
import com.traceradar.domain.TransferKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.traceradar.fixtures.CallNodeBuilder.call;
import static com.traceradar.fixtures.CallNodeBuilder.tracked;
import static org.assertj.core.api.Assertions.assertThat;

class PatternClassifierTest {

    private final PatternClassifier classifier = new PatternClassifier();

    @Test
    void classify_singleTransfer_isSimpleTransfer() {
        TransactionPattern pattern = classifier.classify(
                List.of(tracked(KnownFunctions.TRANSFER).gas(52_000).build()), transfers(1));

        assertThat(pattern.type()).isEqualTo(PatternType.SIMPLE_TRANSFER);
        assertThat(pattern.confidence()).isEqualTo(0.90);
    }

    @Test
    void classify_mintWithTransfer_supplyChangeOutranksOtherMatches() {
        List<ProcessedCallNode> nodes = List.of(
                tracked(KnownFunctions.MINT).build(),
                tracked(KnownFunctions.TRANSFER).at(0).build());

        TransactionPattern pattern = classifier.classify(nodes, transfers(2));

        assertThat(pattern.type()).isEqualTo(PatternType.SUPPLY_CHANGE);
        assertThat(pattern.matches()).extracting(PatternMatch::type)
                .containsExactly(PatternType.SUPPLY_CHANGE, PatternType.LIQUIDITY_PROVISION);
    }

    @Test
    void classify_trackedTransferFromWithThreeExternalCalls_isSwap() {
        List<ProcessedCallNode> nodes = List.of(
                tracked(KnownFunctions.TRANSFER_FROM).build(),
                call().at(0).build(),
                call().at(1).build(),
                call().at(2).build());

        TransactionPattern pattern = classifier.classify(nodes, transfers(1));

        assertThat(pattern.type()).isEqualTo(PatternType.SWAP_OPERATION);
        assertThat(pattern.confidence()).isEqualTo(0.70);
    }

    @Test
    void classify_equalConfidence_keepsRuleOrder() {
        List<ProcessedCallNode> nodes = List.of(
                tracked(KnownFunctions.MINT).gas(600_000).build(),
                tracked("mintBatch(address[],uint256[])").at(0).build());

        TransactionPattern pattern = classifier.classify(nodes, transfers(1));

        assertThat(pattern.matches()).extracting(PatternMatch::type)
                .containsExactly(PatternType.SUPPLY_CHANGE, PatternType.LIQUIDITY_PROVISION, PatternType.BRIDGE_OPERATION);
    }

    @Test
    void classify_noRuleMatches_isUnknown() {
        TransactionPattern pattern = classifier.classify(List.of(call().build()), List.of());

        assertThat(pattern.type()).isEqualTo(PatternType.UNKNOWN);
        assertThat(pattern.confidence()).isZero();
        assertThat(pattern.matches()).isEmpty();
    }

    @Test
    void classify_emptyTrace_isUnknown() {
        assertThat(classifier.classify(List.of(), List.of()).type()).isEqualTo(PatternType.UNKNOWN);
    }

    private static List<TokenTransferEvent> transfers(int count) {
        List<TokenTransferEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(new TokenTransferEvent(TransferKind.TRANSFER, "0xa", "0xb", BigInteger.ONE, BigDecimal.ONE, List.of(), i));
        }
        return events;
    }
}
