package com.prediction.worthhub.worth_hub.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.EscrowTransfer;
import com.prediction.worthhub.worth_hub.entity.Topic;
import com.prediction.worthhub.worth_hub.entity.TransferType;

@DisplayName("In-memory ledger store")
class InMemoryLedgerStoreTest {

    private final InMemoryLedgerStore store = new InMemoryLedgerStore();

    private static Topic topic(int commitmentCount) {
        return Topic.builder().id("topic-1").topicId(1L).commitmentCount(commitmentCount).build();
    }

    private static EscrowTransfer transfer(String nonce, long sequence) {
        return EscrowTransfer.builder()
                .id("vault-1:" + sequence)
                .nonce(nonce)
                .escrowAddress("vault-1")
                .type(TransferType.DEPOSIT)
                .amount(10L)
                .sequence(sequence)
                .build();
    }

    @Test
    @DisplayName("Should hand out detached copies")
    void copies() {
        store.apply(LedgerWrite.builder().topic(topic(1)).build());

        Topic read = store.findTopic("topic-1").orElseThrow();
        read.setCommitmentCount(99);

        assertThat(store.findTopic("topic-1").orElseThrow().getCommitmentCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject the whole write when a transfer nonce repeats")
    void duplicateNonceIsAtomic() {
        store.apply(LedgerWrite.builder().topic(topic(1)).transfer(transfer("c1:deposit", 0)).build());

        assertThatThrownBy(() -> store.apply(LedgerWrite.builder()
                .topic(topic(2))
                .transfer(transfer("c2:deposit", 1))
                .transfer(transfer("c1:deposit", 2))
                .build()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("c1:deposit");

        assertThat(store.findTopic("topic-1").orElseThrow().getCommitmentCount()).isEqualTo(1);
        assertThat(store.findTransfers("vault-1")).extracting(EscrowTransfer::getNonce).containsExactly("c1:deposit");
    }

    @Test
    @DisplayName("Should list commitments in submit order")
    void commitmentOrder() {
        store.apply(LedgerWrite.builder()
                .commitment(Commitment.builder().id("b").topicAddress("topic-1").submitOrder(1).build())
                .commitment(Commitment.builder().id("a").topicAddress("topic-1").submitOrder(0).build())
                .commitment(Commitment.builder().id("x").topicAddress("topic-2").submitOrder(0).build())
                .build());

        assertThat(store.findCommitments("topic-1")).extracting(Commitment::getId).containsExactly("a", "b");
    }
}
