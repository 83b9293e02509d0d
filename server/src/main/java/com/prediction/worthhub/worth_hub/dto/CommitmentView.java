package com.prediction.worthhub.worth_hub.dto;

import java.util.HexFormat;

import com.prediction.worthhub.worth_hub.entity.Commitment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class CommitmentView {

    private final String address;
    private final String topicAddress;
    private final String participant;
    private final String commitmentHash;
    private final long stakeAmount;
    private final int submitOrder;
    private final boolean revealed;

    /** Null until revealed. */
    private final Long predictionValue;

    private final boolean settled;

    public static CommitmentView from(Commitment commitment) {
        return CommitmentView.builder()
                .address(commitment.getId())
                .topicAddress(commitment.getTopicAddress())
                .participant(commitment.getParticipant())
                .commitmentHash(HexFormat.of().formatHex(commitment.getCommitmentHash()))
                .stakeAmount(commitment.getStakeAmount())
                .submitOrder(commitment.getSubmitOrder())
                .revealed(commitment.isRevealed())
                .predictionValue(commitment.isRevealed() ? commitment.getPredictionValue() : null)
                .settled(commitment.isSettled())
                .build();
    }
}
