package com.prediction.worthhub.worth_hub.execution;

import java.util.List;

import com.prediction.worthhub.worth_hub.entity.Identity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * One signed instruction against a topic. Which payload fields are read
 * depends on {@link #type}:
 *
 * CREATE_TOPIC: description, symbol, commitDeadline, revealDeadline, minStake, truthAuthority
 * COMMIT:       commitmentHash, stake
 * REVEAL:       predictionValue, salt
 * FINALIZE:     truthValue
 * SETTLE:       participants
 */
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Instruction {

    private final InstructionType type;

    /** Authenticated identity issuing the instruction. */
    private final Identity signer;

    private final long topicId;

    private final String description;
    private final String symbol;
    private final long commitDeadline;
    private final long revealDeadline;
    private final long minStake;
    private final Identity truthAuthority;

    private final byte[] commitmentHash;
    private final long stake;

    private final long predictionValue;
    private final byte[] salt;

    private final long truthValue;

    private final List<Identity> participants;
}
