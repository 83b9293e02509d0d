package com.prediction.worthhub.worth_hub.execution;

import static com.prediction.worthhub.worth_hub.support.ErrorAssertions.assertRejected;
import static com.prediction.worthhub.worth_hub.support.Identities.identity;
import static com.prediction.worthhub.worth_hub.support.Identities.salt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.prediction.worthhub.worth_hub.crypto.CommitmentScheme;
import com.prediction.worthhub.worth_hub.engine.SettlementEngine;
import com.prediction.worthhub.worth_hub.engine.TopicStateMachine;
import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Identity;
import com.prediction.worthhub.worth_hub.entity.TopicStatus;
import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;
import com.prediction.worthhub.worth_hub.ledger.InMemoryLedgerStore;
import com.prediction.worthhub.worth_hub.service.EscrowService;
import com.prediction.worthhub.worth_hub.service.TopicValidator;
import com.prediction.worthhub.worth_hub.support.MutableClock;

@DisplayName("Topic execution registry")
class TopicExecutionRegistryTest {

    private static final long NOW = 1_700_000_000L;

    private TopicExecutionRegistry registry;

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.shutdown();
        }
    }

    @Test
    @DisplayName("Should rethrow the state machine's typed failure unwrapped")
    void unwrapsFailures() {
        InstructionProcessor processor = mock(InstructionProcessor.class);
        when(processor.process(any())).thenThrow(new WorthHubException(ErrorCode.CommitPhaseEnded));
        registry = new TopicExecutionRegistry(processor);

        assertRejected(() -> registry.execute(Instruction.builder()
                .type(InstructionType.COMMIT)
                .topicId(1L)
                .build()), ErrorCode.CommitPhaseEnded);
    }

    @Test
    @DisplayName("Should keep one executor per topic")
    void executorPerTopic() {
        InstructionProcessor processor = mock(InstructionProcessor.class);
        when(processor.process(any())).thenReturn(InstructionReceipt.builder().type(InstructionType.FINALIZE).build());
        registry = new TopicExecutionRegistry(processor);

        registry.execute(Instruction.builder().type(InstructionType.FINALIZE).topicId(1L).build());
        registry.execute(Instruction.builder().type(InstructionType.FINALIZE).topicId(1L).build());
        registry.execute(Instruction.builder().type(InstructionType.FINALIZE).topicId(2L).build());

        assertThat(registry.activeTopics()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should retire a topic's executor once the topic is settled")
    void retiresSettledTopic() {
        MutableClock clock = new MutableClock(NOW);
        CommitmentScheme scheme = new CommitmentScheme();
        registry = new TopicExecutionRegistry(new InstructionProcessor(newMachine(clock)));

        Identity oracle = identity(1);
        Identity alice = identity(2);
        registry.execute(Instruction.builder()
                .type(InstructionType.CREATE_TOPIC)
                .signer(oracle)
                .topicId(9L)
                .description("retire")
                .symbol("R")
                .commitDeadline(NOW + 100)
                .revealDeadline(NOW + 200)
                .minStake(1L)
                .truthAuthority(oracle)
                .build());
        registry.execute(Instruction.builder()
                .type(InstructionType.COMMIT)
                .signer(alice)
                .topicId(9L)
                .commitmentHash(scheme.compute(42L, salt(3), alice))
                .stake(10L)
                .build());
        clock.setEpochSecond(NOW + 100);
        registry.execute(Instruction.builder()
                .type(InstructionType.REVEAL)
                .signer(alice)
                .topicId(9L)
                .predictionValue(42L)
                .salt(salt(3))
                .build());
        clock.setEpochSecond(NOW + 200);
        registry.execute(Instruction.builder()
                .type(InstructionType.FINALIZE)
                .signer(oracle)
                .topicId(9L)
                .truthValue(40L)
                .build());
        assertThat(registry.activeTopics()).isEqualTo(1);

        InstructionReceipt receipt = registry.execute(Instruction.builder()
                .type(InstructionType.SETTLE)
                .signer(alice)
                .topicId(9L)
                .participants(List.of(alice))
                .build());

        assertThat(receipt.getSettlement().getStatus()).isEqualTo(TopicStatus.SETTLED);
        assertThat(registry.activeTopics()).isZero();

        assertRejected(() -> registry.execute(Instruction.builder()
                .type(InstructionType.SETTLE)
                .signer(alice)
                .topicId(9L)
                .participants(List.of(alice))
                .build()), ErrorCode.AlreadySettled);
        assertThat(registry.activeTopics()).isZero();
    }

    @Test
    @DisplayName("Should not keep an executor for an unknown topic")
    void retiresUnknownTopic() {
        registry = new TopicExecutionRegistry(new InstructionProcessor(newMachine(new MutableClock(NOW))));

        assertRejected(() -> registry.execute(Instruction.builder()
                .type(InstructionType.COMMIT)
                .signer(identity(2))
                .topicId(404L)
                .commitmentHash(new byte[32])
                .stake(10L)
                .build()), ErrorCode.TopicNotFound);

        assertThat(registry.activeTopics()).isZero();
    }

    @Test
    @DisplayName("Should serialize concurrent commits into dense submit orders")
    void concurrentCommits() throws Exception {
        CommitmentScheme scheme = new CommitmentScheme();
        TopicStateMachine machine = newMachine(new MutableClock(NOW));
        registry = new TopicExecutionRegistry(new InstructionProcessor(machine));

        Identity creator = identity(1);
        registry.execute(Instruction.builder()
                .type(InstructionType.CREATE_TOPIC)
                .signer(creator)
                .topicId(5L)
                .description("load")
                .symbol("L")
                .commitDeadline(NOW + 100)
                .revealDeadline(NOW + 200)
                .minStake(1L)
                .truthAuthority(creator)
                .build());

        int participants = 24;
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try {
            List<Callable<InstructionReceipt>> commits = new ArrayList<>();
            for (int i = 0; i < participants; i++) {
                Identity participant = identity(0x20 + i);
                byte[] hash = scheme.compute(i, salt(i), participant);
                commits.add(() -> registry.execute(Instruction.builder()
                        .type(InstructionType.COMMIT)
                        .signer(participant)
                        .topicId(5L)
                        .commitmentHash(hash)
                        .stake(10L)
                        .build()));
            }
            for (Future<InstructionReceipt> future : callers.invokeAll(commits)) {
                future.get();
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(machine.getCommitments(5L))
                .extracting(Commitment::getSubmitOrder)
                .containsExactlyElementsOf(IntStream.range(0, participants).boxed().toList());
        assertThat(machine.getTopic(5L).getTotalStake()).isEqualTo(participants * 10L);
    }

    private static TopicStateMachine newMachine(MutableClock clock) {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        return new TopicStateMachine(store, new CommitmentScheme(), new SettlementEngine(),
                new TopicValidator(256, 32), new EscrowService(store), clock, 0L, 0);
    }
}
