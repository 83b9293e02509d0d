package com.prediction.worthhub.worth_hub.execution;

import static com.prediction.worthhub.worth_hub.support.Identities.identity;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.prediction.worthhub.worth_hub.engine.SettlementReceipt;
import com.prediction.worthhub.worth_hub.engine.TopicStateMachine;
import com.prediction.worthhub.worth_hub.entity.Identity;
import com.prediction.worthhub.worth_hub.entity.Topic;
import com.prediction.worthhub.worth_hub.entity.TopicStatus;

@ExtendWith(MockitoExtension.class)
@DisplayName("Instruction processor")
class InstructionProcessorTest {

    @Mock
    private TopicStateMachine stateMachine;

    @InjectMocks
    private InstructionProcessor processor;

    private final Identity oracle = identity(0x0F);

    @Test
    @DisplayName("Should route FINALIZE to the state machine with the signer as caller")
    void finalizeRoute() {
        Topic finalized = Topic.builder().topicId(3L).status(TopicStatus.FINALIZED).build();
        when(stateMachine.finalizeTopic(oracle, 3L, 42L)).thenReturn(finalized);

        InstructionReceipt receipt = processor.process(Instruction.builder()
                .type(InstructionType.FINALIZE)
                .signer(oracle)
                .topicId(3L)
                .truthValue(42L)
                .build());

        assertThat(receipt.getType()).isEqualTo(InstructionType.FINALIZE);
        assertThat(receipt.getTopic()).isSameAs(finalized);
    }

    @Test
    @DisplayName("Should attach the settlement receipt to SETTLE")
    void settleRoute() {
        SettlementReceipt settlement = SettlementReceipt.builder().status(TopicStatus.SETTLED).build();
        Topic settled = Topic.builder().topicId(3L).status(TopicStatus.SETTLED).build();
        when(stateMachine.settle(eq(oracle), eq(3L), anyCollection())).thenReturn(settlement);
        when(stateMachine.getTopic(3L)).thenReturn(settled);

        InstructionReceipt receipt = processor.process(Instruction.builder()
                .type(InstructionType.SETTLE)
                .signer(oracle)
                .topicId(3L)
                .participants(List.of(identity(1), identity(2)))
                .build());

        assertThat(receipt.getSettlement()).isSameAs(settlement);
        assertThat(receipt.getTopic().getStatus()).isEqualTo(TopicStatus.SETTLED);
        verify(stateMachine).settle(oracle, 3L, List.of(identity(1), identity(2)));
    }
}
