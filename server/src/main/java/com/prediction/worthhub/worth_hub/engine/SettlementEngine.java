package com.prediction.worthhub.worth_hub.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.FixedPoint;
import com.prediction.worthhub.worth_hub.entity.Topic;
import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;

import lombok.extern.slf4j.Slf4j;

/**
 * Computes how a finalized topic's stake flows back to its participants.
 *
 * Algorithm:
 *   1. consensus = Σ(stake_i × prediction_i) / Σ(stake_i) over revealers (truncating)
 *   2. truth_edge = truth − consensus
 *   3. edge_i = prediction_i − consensus
 *   4. W_e(i) = PRECISION² / (|truth − prediction_i| + 1)
 *   5. T_f(i) = PRECISION² / ln(submit_order_i + e)       (lookup table)
 *   6. score_i = W_e × T_f when edge_i and truth_edge share a sign, else 0
 *   7. payout_i = stake_i + bonus_pool × score_i / Σ score
 *      (pro-rata to stake when Σ score == 0)
 *   8. non-revealers get 0; their stake is the loser pool
 *
 * The platform reserve is withheld from the loser pool first and only touches
 * revealed stakes when the pool is too small. Integer remainders go to the
 * lowest submit order among the recipients, so nothing leaks to rounding.
 * If nobody revealed, stakes are refunded pro-rata minus the reserve.
 *
 * Pure and deterministic: no clock, no I/O, no floating point.
 */
@Slf4j
public class SettlementEngine {

    private static final BigInteger PRECISION_SQUARED =
            BigInteger.valueOf(FixedPoint.PRECISION).multiply(BigInteger.valueOf(FixedPoint.PRECISION));

    public SettlementPlan compute(Topic topic, List<Commitment> commitments, long reserve) {
        try {
            return doCompute(topic, commitments, reserve);
        } catch (ArithmeticException e) {
            throw new WorthHubException(ErrorCode.ArithmeticOverflow, e);
        }
    }

    private SettlementPlan doCompute(Topic topic, List<Commitment> commitments, long reserve) {
        List<Commitment> ordered = new ArrayList<>(commitments);
        ordered.sort(Comparator.comparingInt(Commitment::getSubmitOrder));

        long totalStake = 0;
        long revealedStake = 0;
        long loserPool = 0;
        BigInteger weightedSum = BigInteger.ZERO;

        for (Commitment c : ordered) {
            totalStake = Math.addExact(totalStake, c.getStakeAmount());
            if (c.isRevealed()) {
                revealedStake = Math.addExact(revealedStake, c.getStakeAmount());
                weightedSum = weightedSum.add(
                        BigInteger.valueOf(c.getStakeAmount()).multiply(BigInteger.valueOf(c.getPredictionValue())));
            } else {
                loserPool = Math.addExact(loserPool, c.getStakeAmount());
            }
        }

        if (totalStake != topic.getTotalStake()) {
            throw new IllegalStateException(String.format(
                    "Commitment stakes (%d) do not add up to topic total stake (%d), topicId=%d",
                    totalStake, topic.getTotalStake(), topic.getTopicId()));
        }

        long retained = Math.min(Math.max(reserve, 0), totalStake);

        SettlementPlan plan = revealedStake == 0
                ? refundPlan(topic, ordered, totalStake, retained)
                : scoredPlan(topic, ordered, totalStake, revealedStake, loserPool, weightedSum, reserve, retained);

        long paid = plan.totalPaid();
        if (paid + plan.getRetained() != totalStake) {
            throw new IllegalStateException(String.format(
                    "Settlement does not conserve value: paid=%d retained=%d total=%d (topicId=%d)",
                    paid, plan.getRetained(), totalStake, topic.getTopicId()));
        }

        log.debug("Settlement plan: topicId={}, consensus={}, loserPool={}, bonusPool={}, retained={}, paid={}",
                topic.getTopicId(), plan.getConsensus(), plan.getLoserPool(), plan.getBonusPool(), retained, paid);
        return plan;
    }

    /**
     * Nobody revealed: there is no one to forfeit to, so every staker gets a
     * pro-rata refund of what is left after the reserve.
     */
    private SettlementPlan refundPlan(Topic topic, List<Commitment> ordered, long totalStake, long retained) {
        BigInteger[] weights = new BigInteger[ordered.size()];
        for (int i = 0; i < ordered.size(); i++) {
            weights[i] = BigInteger.valueOf(ordered.get(i).getStakeAmount());
        }
        long[] refunds = apportion(totalStake - retained, weights);

        List<ParticipantPayout> payouts = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Commitment c = ordered.get(i);
            payouts.add(ParticipantPayout.builder()
                    .commitmentAddress(c.getId())
                    .participant(c.getParticipant())
                    .submitOrder(c.getSubmitOrder())
                    .stake(c.getStakeAmount())
                    .revealed(false)
                    .edge(BigInteger.ZERO)
                    .score(BigInteger.ZERO)
                    .payout(refunds[i])
                    .build());
        }

        return SettlementPlan.builder()
                .topicId(topic.getTopicId())
                .truthValue(topic.getTruthValue())
                .totalStake(totalStake)
                .revealedStake(0)
                .loserPool(totalStake)
                .bonusPool(0)
                .retained(retained)
                .totalScore(BigInteger.ZERO)
                .payouts(payouts)
                .build();
    }

    private SettlementPlan scoredPlan(Topic topic, List<Commitment> ordered, long totalStake, long revealedStake,
            long loserPool, BigInteger weightedSum, long reserve, long retained) {

        long truth = topic.getTruthValue();
        long consensus = weightedSum.divide(BigInteger.valueOf(revealedStake)).longValueExact();
        // Differences of two arbitrary i64 values need 65 bits.
        BigInteger bigTruth = BigInteger.valueOf(truth);
        BigInteger truthEdge = bigTruth.subtract(BigInteger.valueOf(consensus));

        long reserveFromPool = Math.min(Math.max(reserve, 0), loserPool);
        long bonusPool = loserPool - reserveFromPool;
        long reserveFromStakes = retained - reserveFromPool;

        int n = ordered.size();
        BigInteger[] edges = new BigInteger[n];
        boolean[] aligned = new boolean[n];
        long[] accuracy = new long[n];
        long[] decay = new long[n];
        BigInteger[] scores = new BigInteger[n];
        BigInteger[] stakeWeights = new BigInteger[n];
        BigInteger totalScore = BigInteger.ZERO;

        for (int i = 0; i < n; i++) {
            Commitment c = ordered.get(i);
            edges[i] = BigInteger.ZERO;
            scores[i] = BigInteger.ZERO;
            stakeWeights[i] = BigInteger.ZERO;
            if (!c.isRevealed()) {
                continue;
            }
            stakeWeights[i] = BigInteger.valueOf(c.getStakeAmount());

            BigInteger prediction = BigInteger.valueOf(c.getPredictionValue());
            edges[i] = prediction.subtract(BigInteger.valueOf(consensus));
            aligned[i] = sameDirection(edges[i], truthEdge);

            BigInteger error = bigTruth.subtract(prediction).abs();
            accuracy[i] = PRECISION_SQUARED.divide(error.add(BigInteger.ONE)).longValueExact();
            decay[i] = TimeDecay.weight(c.getSubmitOrder());

            if (aligned[i]) {
                scores[i] = BigInteger.valueOf(accuracy[i]).multiply(BigInteger.valueOf(decay[i]));
                totalScore = totalScore.add(scores[i]);
            }
        }

        boolean fallback = totalScore.signum() == 0;
        long[] bonuses = apportion(bonusPool, fallback ? stakeWeights : scores);
        long[] returned = reserveFromStakes == 0
                ? stakesOf(ordered)
                : apportion(revealedStake - reserveFromStakes, stakeWeights);

        List<ParticipantPayout> payouts = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Commitment c = ordered.get(i);
            boolean revealed = c.isRevealed();
            payouts.add(ParticipantPayout.builder()
                    .commitmentAddress(c.getId())
                    .participant(c.getParticipant())
                    .submitOrder(c.getSubmitOrder())
                    .stake(c.getStakeAmount())
                    .revealed(revealed)
                    .predictionValue(revealed ? c.getPredictionValue() : 0)
                    .edge(edges[i])
                    .aligned(aligned[i])
                    .accuracyWeight(accuracy[i])
                    .timeDecayWeight(decay[i])
                    .score(scores[i])
                    .bonus(revealed ? bonuses[i] : 0)
                    .payout(revealed ? Math.addExact(returned[i], bonuses[i]) : 0)
                    .build());
        }

        return SettlementPlan.builder()
                .topicId(topic.getTopicId())
                .truthValue(truth)
                .consensus(consensus)
                .truthEdge(truthEdge)
                .totalStake(totalStake)
                .revealedStake(revealedStake)
                .loserPool(loserPool)
                .bonusPool(bonusPool)
                .retained(retained)
                .totalScore(totalScore)
                .stakeWeightedFallback(fallback)
                .payouts(payouts)
                .build();
    }

    /**
     * Both non-negative or both non-positive.
     */
    static boolean sameDirection(BigInteger edge, BigInteger truthEdge) {
        return (edge.signum() >= 0 && truthEdge.signum() >= 0) || (edge.signum() <= 0 && truthEdge.signum() <= 0);
    }

    private static long[] stakesOf(List<Commitment> ordered) {
        long[] stakes = new long[ordered.size()];
        for (int i = 0; i < stakes.length; i++) {
            stakes[i] = ordered.get(i).isRevealed() ? ordered.get(i).getStakeAmount() : 0;
        }
        return stakes;
    }

    /**
     * Split {@code pool} in proportion to {@code weights} with truncating
     * division; the remainder goes to the first positive weight (weights are in
     * submit order). All-zero weights yield all-zero shares.
     */
    static long[] apportion(long pool, BigInteger[] weights) {
        long[] shares = new long[weights.length];
        BigInteger total = BigInteger.ZERO;
        for (BigInteger w : weights) {
            total = total.add(w);
        }
        if (pool == 0 || total.signum() == 0) {
            return shares;
        }

        BigInteger bigPool = BigInteger.valueOf(pool);
        long distributed = 0;
        int first = -1;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i].signum() <= 0) {
                continue;
            }
            if (first < 0) {
                first = i;
            }
            shares[i] = bigPool.multiply(weights[i]).divide(total).longValueExact();
            distributed += shares[i];
        }
        shares[first] += pool - distributed;
        return shares;
    }
}
