package com.prediction.worthhub.worth_hub.engine;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Deterministic payout distribution for a finalized topic.
 *
 * Conservation: sum(payout) + retained == totalStake.
 */
@Getter
@Builder
@AllArgsConstructor
public class SettlementPlan {

    private final long topicId;
    private final long truthValue;

    /** Stake-weighted mean of revealed predictions; null when nobody revealed. */
    private final Long consensus;

    /** truth − consensus; null when nobody revealed. */
    private final BigInteger truthEdge;

    private final long totalStake;
    private final long revealedStake;

    /** Stake forfeited by participants who never revealed. */
    private final long loserPool;

    /** Loser pool left for revealers once the reserve has been withheld. */
    private final long bonusPool;

    /** Amount the escrow keeps as platform reserve. */
    private final long retained;

    private final BigInteger totalScore;

    /** Nobody was directionally aligned; the bonus pool went out pro-rata to stake. */
    private final boolean stakeWeightedFallback;

    private final List<ParticipantPayout> payouts;

    public long totalPaid() {
        return payouts.stream().mapToLong(ParticipantPayout::getPayout).sum();
    }

    public Optional<ParticipantPayout> payoutFor(String participant) {
        return payouts.stream()
                .filter(p -> p.getParticipant().equals(participant))
                .findFirst();
    }
}
