package com.prediction.worthhub.worth_hub.ledger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Escrow;
import com.prediction.worthhub.worth_hub.entity.EscrowTransfer;
import com.prediction.worthhub.worth_hub.entity.Topic;

import lombok.extern.slf4j.Slf4j;

/**
 * Ledger kept in process memory. Selected with {@code worthhub.ledger.store=memory};
 * state is lost on restart.
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final ConcurrentHashMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Commitment> commitments = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Escrow> escrows = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, EscrowTransfer> transfers = new ConcurrentHashMap<>();

    @Override
    public Optional<Topic> findTopic(String topicAddress) {
        return Optional.ofNullable(topics.get(topicAddress)).map(Topic::copy);
    }

    @Override
    public Optional<Commitment> findCommitment(String commitmentAddress) {
        return Optional.ofNullable(commitments.get(commitmentAddress)).map(Commitment::copy);
    }

    @Override
    public List<Commitment> findCommitments(String topicAddress) {
        return commitments.values().stream()
                .filter(c -> c.getTopicAddress().equals(topicAddress))
                .sorted(Comparator.comparingInt(Commitment::getSubmitOrder))
                .map(Commitment::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Escrow> findEscrow(String escrowAddress) {
        return Optional.ofNullable(escrows.get(escrowAddress)).map(Escrow::copy);
    }

    @Override
    public List<Escrow> findAllEscrows() {
        return escrows.values().stream().map(Escrow::copy).collect(Collectors.toList());
    }

    @Override
    public List<EscrowTransfer> findTransfers(String escrowAddress) {
        return transfers.values().stream()
                .filter(t -> t.getEscrowAddress().equals(escrowAddress))
                .sorted(Comparator.comparingLong(EscrowTransfer::getSequence))
                .map(EscrowTransfer::copy)
                .collect(Collectors.toList());
    }

    /**
     * Readers never observe half a write: every map is updated under one lock
     * and only after the nonce check has passed for all transfers.
     */
    @Override
    public synchronized void apply(LedgerWrite write) {
        Map<String, EscrowTransfer> staged = new LinkedHashMap<>();
        for (EscrowTransfer transfer : write.getTransfers()) {
            if (transfers.containsKey(transfer.getNonce()) || staged.putIfAbsent(transfer.getNonce(), transfer) != null) {
                throw new IllegalStateException("Duplicate escrow transfer nonce: " + transfer.getNonce());
            }
        }

        if (write.getTopic() != null) {
            topics.put(write.getTopic().getId(), write.getTopic().copy());
        }
        for (Commitment commitment : write.getCommitments()) {
            commitments.put(commitment.getId(), commitment.copy());
        }
        if (write.getEscrow() != null) {
            escrows.put(write.getEscrow().getId(), write.getEscrow().copy());
        }
        List<EscrowTransfer> applied = new ArrayList<>(staged.values());
        for (EscrowTransfer transfer : applied) {
            transfers.put(transfer.getNonce(), transfer.copy());
        }

        log.debug("Applied ledger write: topic={}, commitments={}, transfers={}",
                write.getTopic() != null ? write.getTopic().getTopicId() : null,
                write.getCommitments().size(), applied.size());
    }
}
