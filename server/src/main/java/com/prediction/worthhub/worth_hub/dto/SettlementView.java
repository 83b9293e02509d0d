package com.prediction.worthhub.worth_hub.dto;

import java.util.List;
import java.util.stream.Collectors;

import com.prediction.worthhub.worth_hub.engine.ParticipantPayout;
import com.prediction.worthhub.worth_hub.engine.SettlementPlan;
import com.prediction.worthhub.worth_hub.engine.SettlementReceipt;
import com.prediction.worthhub.worth_hub.entity.TopicStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Settlement summary. Scores and the truth edge are rendered as decimal
 * strings because they can exceed the range of a JSON number that clients
 * parse safely.
 */
@Getter
@Builder
@AllArgsConstructor
public class SettlementView {

    private final long topicId;
    private final TopicStatus status;
    private final long truthValue;
    private final Long consensus;
    private final String truthEdge;
    private final long totalStake;
    private final long loserPool;
    private final long bonusPool;
    private final long retained;
    private final String totalScore;
    private final boolean stakeWeightedFallback;
    private final int commitmentsSettled;
    private final long amountPaid;
    private final int ledgerWrites;
    private final List<Payout> payouts;

    @Getter
    @Builder
    @AllArgsConstructor
    public static class Payout {
        private final String participant;
        private final int submitOrder;
        private final long stake;
        private final boolean revealed;
        private final boolean aligned;
        private final long accuracyWeight;
        private final long timeDecayWeight;
        private final String score;
        private final long payout;

        static Payout from(ParticipantPayout p) {
            return Payout.builder()
                    .participant(p.getParticipant())
                    .submitOrder(p.getSubmitOrder())
                    .stake(p.getStake())
                    .revealed(p.isRevealed())
                    .aligned(p.isAligned())
                    .accuracyWeight(p.getAccuracyWeight())
                    .timeDecayWeight(p.getTimeDecayWeight())
                    .score(p.getScore().toString())
                    .payout(p.getPayout())
                    .build();
        }
    }

    public static SettlementView from(SettlementReceipt receipt) {
        SettlementPlan plan = receipt.getPlan();
        return SettlementView.builder()
                .topicId(plan.getTopicId())
                .status(receipt.getStatus())
                .truthValue(plan.getTruthValue())
                .consensus(plan.getConsensus())
                .truthEdge(plan.getTruthEdge() == null ? null : plan.getTruthEdge().toString())
                .totalStake(plan.getTotalStake())
                .loserPool(plan.getLoserPool())
                .bonusPool(plan.getBonusPool())
                .retained(plan.getRetained())
                .totalScore(plan.getTotalScore().toString())
                .stakeWeightedFallback(plan.isStakeWeightedFallback())
                .commitmentsSettled(receipt.getCommitmentsSettled())
                .amountPaid(receipt.getAmountPaid())
                .ledgerWrites(receipt.getLedgerWrites())
                .payouts(plan.getPayouts().stream().map(Payout::from).collect(Collectors.toList()))
                .build();
    }
}
