package com.prediction.worthhub.worth_hub.execution;

import com.prediction.worthhub.worth_hub.engine.SettlementReceipt;
import com.prediction.worthhub.worth_hub.engine.TopicStateMachine;
import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Topic;

import lombok.RequiredArgsConstructor;

/**
 * Dispatches an instruction to the state machine, one case per instruction type.
 */
@RequiredArgsConstructor
public class InstructionProcessor {

    private final TopicStateMachine stateMachine;

    public InstructionReceipt process(Instruction instruction) {
        long topicId = instruction.getTopicId();
        return switch (instruction.getType()) {
            case CREATE_TOPIC -> {
                Topic topic = stateMachine.createTopic(
                        instruction.getSigner(),
                        topicId,
                        instruction.getDescription(),
                        instruction.getSymbol(),
                        instruction.getCommitDeadline(),
                        instruction.getRevealDeadline(),
                        instruction.getMinStake(),
                        instruction.getTruthAuthority());
                yield receipt(instruction, topic).build();
            }
            case COMMIT -> {
                Commitment commitment = stateMachine.commit(
                        instruction.getSigner(), topicId, instruction.getCommitmentHash(), instruction.getStake());
                yield receipt(instruction, stateMachine.getTopic(topicId)).commitment(commitment).build();
            }
            case REVEAL -> {
                Commitment commitment = stateMachine.reveal(
                        instruction.getSigner(), topicId, instruction.getPredictionValue(), instruction.getSalt());
                yield receipt(instruction, stateMachine.getTopic(topicId)).commitment(commitment).build();
            }
            case FINALIZE -> {
                Topic topic = stateMachine.finalizeTopic(instruction.getSigner(), topicId, instruction.getTruthValue());
                yield receipt(instruction, topic).build();
            }
            case SETTLE -> {
                SettlementReceipt settlement = stateMachine.settle(
                        instruction.getSigner(), topicId, instruction.getParticipants());
                yield receipt(instruction, stateMachine.getTopic(topicId)).settlement(settlement).build();
            }
        };
    }

    private static InstructionReceipt.InstructionReceiptBuilder receipt(Instruction instruction, Topic topic) {
        return InstructionReceipt.builder().type(instruction.getType()).topic(topic);
    }
}
