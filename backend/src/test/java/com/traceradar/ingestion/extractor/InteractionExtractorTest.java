package com.traceradar.ingestion.extractor;

import com.traceradar.domain.ContractInteractionEdge;
import com.traceradar.domain.ProcessedCallNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.traceradar.fixtures.CallNodeBuilder.call;
import static org.assertj.core.api.Assertions.assertThat;

class InteractionExtractorTest {

    private final InteractionExtractor extractor = new InteractionExtractor();

    @Test
    void extract_aggregatesCallsPerPairInFirstSeenOrder() {
        List<ProcessedCallNode> nodes = List.of(
                call().from("0xa").to("0xb").gas(100).build(),
                call().from("0xb").to("0xc").gas(50).at(0).build(),
                call().from("0xa").to("0xb").gas(30).at(1).build());

        List<ContractInteractionEdge> edges = extractor.extract(nodes);

        assertThat(edges).containsExactly(
                new ContractInteractionEdge("0xa", "0xb", 2, 130),
                new ContractInteractionEdge("0xb", "0xc", 1, 50));
    }

    @Test
    void extract_selfCallsAndBlankParties_areIgnored() {
        List<ProcessedCallNode> nodes = List.of(
                call().from("0xa").to("0xa").build(),
                call().from("0xa").to("").build(),
                call().from(null).to("0xb").build());

        assertThat(extractor.extract(nodes)).isEmpty();
    }

    @Test
    void extract_addressesComparedAsGiven() {
        List<ProcessedCallNode> nodes = List.of(
                call().from("0xa").to("0xB").build(),
                call().from("0xa").to("0xb").build());

        assertThat(extractor.extract(nodes)).hasSize(2);
    }
}
