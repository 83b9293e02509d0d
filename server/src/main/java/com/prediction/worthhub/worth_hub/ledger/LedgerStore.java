package com.prediction.worthhub.worth_hub.ledger;

import java.util.List;
import java.util.Optional;

import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Escrow;
import com.prediction.worthhub.worth_hub.entity.EscrowTransfer;
import com.prediction.worthhub.worth_hub.entity.Topic;

/**
 * Account storage of the ledger, keyed by deterministic address.
 *
 * Reads return detached copies: mutating a returned record has no effect
 * until it is part of an applied {@link LedgerWrite}.
 */
public interface LedgerStore {

    Optional<Topic> findTopic(String topicAddress);

    Optional<Commitment> findCommitment(String commitmentAddress);

    /**
     * @return the topic's commitments ordered by submit order
     */
    List<Commitment> findCommitments(String topicAddress);

    Optional<Escrow> findEscrow(String escrowAddress);

    List<Escrow> findAllEscrows();

    /**
     * @return the escrow's transfers ordered by sequence
     */
    List<EscrowTransfer> findTransfers(String escrowAddress);

    /**
     * Persist every record of the write atomically.
     */
    void apply(LedgerWrite write);
}
