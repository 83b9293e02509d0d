package com.prediction.worthhub.worth_hub.engine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.prediction.worthhub.worth_hub.crypto.CommitmentScheme;
import com.prediction.worthhub.worth_hub.crypto.LedgerAddresses;
import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Escrow;
import com.prediction.worthhub.worth_hub.entity.FixedPoint;
import com.prediction.worthhub.worth_hub.entity.Identity;
import com.prediction.worthhub.worth_hub.entity.Topic;
import com.prediction.worthhub.worth_hub.entity.TopicStatus;
import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;
import com.prediction.worthhub.worth_hub.ledger.LedgerStore;
import com.prediction.worthhub.worth_hub.ledger.LedgerWrite;
import com.prediction.worthhub.worth_hub.service.EscrowService;
import com.prediction.worthhub.worth_hub.service.TopicValidator;

import lombok.extern.slf4j.Slf4j;

/**
 * Topic lifecycle: OPEN → REVEALING → FINALIZED → SETTLED.
 *
 * Every operation validates against the current phase, deadlines and caller,
 * then builds a single {@link LedgerWrite} and applies it. Nothing is written
 * before validation has passed, so a rejected instruction leaves the ledger
 * untouched. Callers must serialize instructions per topic
 * (see TopicExecutionRegistry).
 */
@Slf4j
public class TopicStateMachine {

    private static final HexFormat HEX = HexFormat.of();

    private final LedgerStore ledgerStore;
    private final CommitmentScheme commitmentScheme;
    private final SettlementEngine settlementEngine;
    private final TopicValidator validator;
    private final EscrowService escrowService;
    private final Clock clock;
    private final long reserveLamports;
    private final int maxPayoutsPerWrite;

    public TopicStateMachine(LedgerStore ledgerStore, CommitmentScheme commitmentScheme,
            SettlementEngine settlementEngine, TopicValidator validator, EscrowService escrowService,
            Clock clock, long reserveLamports, int maxPayoutsPerWrite) {
        this.ledgerStore = ledgerStore;
        this.commitmentScheme = commitmentScheme;
        this.settlementEngine = settlementEngine;
        this.validator = validator;
        this.escrowService = escrowService;
        this.clock = clock;
        this.reserveLamports = reserveLamports;
        this.maxPayoutsPerWrite = maxPayoutsPerWrite;
    }

    // ===== Instructions =====

    public Topic createTopic(Identity creator, long topicId, String description, String symbol,
            long commitDeadline, long revealDeadline, long minStake, Identity truthAuthority) {
        long now = now();
        String safeDescription = Objects.requireNonNullElse(description, "");
        String safeSymbol = Objects.requireNonNullElse(symbol, "");
        validator.validateNewTopic(safeDescription, safeSymbol, commitDeadline, revealDeadline, minStake, now);

        Identity topicAddress = LedgerAddresses.topic(topicId);
        if (ledgerStore.findTopic(topicAddress.toHex()).isPresent()) {
            throw new WorthHubException(ErrorCode.TopicAlreadyExists, String.valueOf(topicId));
        }

        Topic topic = Topic.builder()
                .id(topicAddress.toHex())
                .topicId(topicId)
                .creator(creator.toHex())
                .truthAuthority(truthAuthority.toHex())
                .description(safeDescription)
                .symbol(safeSymbol)
                .commitDeadline(commitDeadline)
                .revealDeadline(revealDeadline)
                .minStake(minStake)
                .status(TopicStatus.OPEN)
                .build();
        Escrow escrow = escrowService.open(
                LedgerAddresses.vault(topicAddress).toHex(), topic.getId(), reserveLamports, now);

        ledgerStore.apply(LedgerWrite.builder().topic(topic).escrow(escrow).build());

        log.info("Topic created: id={}, symbol={}, commitDeadline={}, revealDeadline={}, minStake={}",
                topicId, safeSymbol, commitDeadline, revealDeadline, minStake);
        return topic;
    }

    public Commitment commit(Identity participant, long topicId, byte[] commitmentHash, long stake) {
        long now = now();
        CommitmentScheme.requireHash(commitmentHash);
        Topic topic = loadTopic(topicId);
        String commitmentAddress = commitmentAddress(topic, participant);

        boolean alreadyCommitted = ledgerStore.findCommitment(commitmentAddress).isPresent();
        validator.validateCommit(topic, stake, alreadyCommitted, now);

        Escrow escrow = loadEscrow(topic);
        int submitOrder = topic.recordCommitment(stake);
        Commitment commitment = Commitment.builder()
                .id(commitmentAddress)
                .topicAddress(topic.getId())
                .participant(participant.toHex())
                .commitmentHash(commitmentHash.clone())
                .stakeAmount(stake)
                .submitOrder(submitOrder)
                .build();

        ledgerStore.apply(LedgerWrite.builder()
                .topic(topic)
                .commitment(commitment)
                .escrow(escrow)
                .transfer(escrowService.deposit(escrow, commitment, now))
                .build());

        log.info("Commitment #{} received: topicId={}, participant={}, stake={}",
                submitOrder, topicId, participant, stake);
        return commitment;
    }

    public Commitment reveal(Identity participant, long topicId, long predictionValue, byte[] salt) {
        long now = now();
        CommitmentScheme.requireSalt(salt);
        Topic topic = loadTopic(topicId);
        Commitment commitment = ledgerStore.findCommitment(commitmentAddress(topic, participant))
                .orElseThrow(() -> new WorthHubException(ErrorCode.UnknownParticipant, participant.toHex()));

        validator.validateReveal(topic, commitment, now);
        if (!commitmentScheme.verify(commitment.getCommitmentHash(), predictionValue, salt, participant)) {
            log.warn("Reveal rejected: hash mismatch (topicId={}, participant={}, commitment={})",
                    topicId, participant, HEX.formatHex(commitment.getCommitmentHash()));
            throw new WorthHubException(ErrorCode.HashMismatch);
        }

        commitment.reveal(predictionValue);
        topic.recordReveal();
        ledgerStore.apply(LedgerWrite.builder().topic(topic).commitment(commitment).build());

        log.info("Commitment revealed: topicId={}, participant={}, prediction={}",
                topicId, participant, FixedPoint.format(predictionValue));
        return commitment;
    }

    public Topic finalizeTopic(Identity caller, long topicId, long truthValue) {
        long now = now();
        Topic topic = loadTopic(topicId);
        validator.validateFinalize(topic, caller, now);

        topic.finalizeWith(truthValue);
        ledgerStore.apply(LedgerWrite.builder().topic(topic).build());

        log.info("Topic finalized: id={}, truthValue={}", topicId, FixedPoint.format(truthValue));
        return topic;
    }

    /**
     * Pay out a finalized topic. {@code participants} must name every committer.
     *
     * With {@code maxPayoutsPerWrite > 0} the payouts are spread over several
     * ledger writes. Each write marks its commitments settled, so re-invoking
     * after a failed write only pays the commitments still outstanding. The
     * topic becomes SETTLED with the last write.
     */
    public SettlementReceipt settle(Identity caller, long topicId, Collection<Identity> participants) {
        long now = now();
        Topic topic = loadTopic(topicId);
        validator.validateSettleable(topic);

        List<Commitment> commitments = ledgerStore.findCommitments(topic.getId());
        validator.validateExhaustive(commitments, participants);

        Escrow escrow = loadEscrow(topic);
        SettlementPlan plan = settlementEngine.compute(topic, commitments, escrow.getReserve());

        Map<String, Commitment> byAddress = commitments.stream()
                .collect(Collectors.toMap(Commitment::getId, Function.identity()));
        List<ParticipantPayout> pending = plan.getPayouts().stream()
                .filter(p -> !byAddress.get(p.getCommitmentAddress()).isSettled())
                .collect(Collectors.toList());

        List<List<ParticipantPayout>> batches = partition(pending, maxPayoutsPerWrite);
        long amountPaid = 0;
        for (int i = 0; i < batches.size(); i++) {
            LedgerWrite.LedgerWriteBuilder write = LedgerWrite.builder();
            for (ParticipantPayout payout : batches.get(i)) {
                Commitment commitment = byAddress.get(payout.getCommitmentAddress());
                commitment.markSettled();
                write.commitment(commitment);
                if (payout.getPayout() > 0) {
                    write.transfer(escrowService.payout(escrow, commitment, payout.getPayout(), now));
                    amountPaid += payout.getPayout();
                }
            }
            if (i == batches.size() - 1) {
                topic.transitionTo(TopicStatus.SETTLED);
                write.topic(topic);
            }
            ledgerStore.apply(write.escrow(escrow).build());
        }

        log.info("Topic settled: id={}, by={}, truth={}, consensus={}, participants={}, loserPool={}, paid={}, retained={}",
                topicId, caller, FixedPoint.format(plan.getTruthValue()),
                plan.getConsensus() != null ? FixedPoint.format(plan.getConsensus()) : "n/a",
                commitments.size(), plan.getLoserPool(), amountPaid, escrow.getBalance());

        return SettlementReceipt.builder()
                .plan(plan)
                .commitmentsSettled(pending.size())
                .amountPaid(amountPaid)
                .ledgerWrites(batches.size())
                .status(topic.getStatus())
                .build();
    }

    // ===== Queries =====

    public Topic getTopic(long topicId) {
        return loadTopic(topicId);
    }

    public Commitment getCommitment(long topicId, Identity participant) {
        Topic topic = loadTopic(topicId);
        return ledgerStore.findCommitment(commitmentAddress(topic, participant))
                .orElseThrow(() -> new WorthHubException(ErrorCode.UnknownParticipant, participant.toHex()));
    }

    public List<Commitment> getCommitments(long topicId) {
        return ledgerStore.findCommitments(loadTopic(topicId).getId());
    }

    public Escrow getEscrow(long topicId) {
        return loadEscrow(loadTopic(topicId));
    }

    // ===== Helpers =====

    private Topic loadTopic(long topicId) {
        return ledgerStore.findTopic(LedgerAddresses.topic(topicId).toHex())
                .orElseThrow(() -> new WorthHubException(ErrorCode.TopicNotFound, String.valueOf(topicId)));
    }

    private Escrow loadEscrow(Topic topic) {
        String vault = LedgerAddresses.vault(Identity.fromHex(topic.getId())).toHex();
        return ledgerStore.findEscrow(vault)
                .orElseThrow(() -> new IllegalStateException("Escrow missing for topic " + topic.getTopicId()));
    }

    private static String commitmentAddress(Topic topic, Identity participant) {
        return LedgerAddresses.commitment(Identity.fromHex(topic.getId()), participant).toHex();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    /**
     * Always at least one (possibly empty) batch, so the status flip has a write.
     */
    private static List<List<ParticipantPayout>> partition(List<ParticipantPayout> payouts, int size) {
        List<List<ParticipantPayout>> batches = new ArrayList<>();
        if (size <= 0 || payouts.size() <= size) {
            batches.add(payouts);
            return batches;
        }
        for (int start = 0; start < payouts.size(); start += size) {
            batches.add(payouts.subList(start, Math.min(start + size, payouts.size())));
        }
        return batches;
    }
}
