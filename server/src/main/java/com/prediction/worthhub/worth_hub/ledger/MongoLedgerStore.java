package com.prediction.worthhub.worth_hub.ledger;

import java.util.List;
import java.util.Optional;

import org.springframework.transaction.support.TransactionTemplate;

import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Escrow;
import com.prediction.worthhub.worth_hub.entity.EscrowTransfer;
import com.prediction.worthhub.worth_hub.entity.Topic;
import com.prediction.worthhub.worth_hub.repositories.CommitmentRepository;
import com.prediction.worthhub.worth_hub.repositories.EscrowRepository;
import com.prediction.worthhub.worth_hub.repositories.EscrowTransferRepository;
import com.prediction.worthhub.worth_hub.repositories.TopicRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * MongoDB-backed ledger. Each {@link LedgerWrite} runs inside one
 * multi-document transaction, which requires a replica set deployment.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoLedgerStore implements LedgerStore {

    private final TopicRepository topicRepository;
    private final CommitmentRepository commitmentRepository;
    private final EscrowRepository escrowRepository;
    private final EscrowTransferRepository escrowTransferRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Optional<Topic> findTopic(String topicAddress) {
        return topicRepository.findById(topicAddress);
    }

    @Override
    public Optional<Commitment> findCommitment(String commitmentAddress) {
        return commitmentRepository.findById(commitmentAddress);
    }

    @Override
    public List<Commitment> findCommitments(String topicAddress) {
        return commitmentRepository.findByTopicAddressOrderBySubmitOrderAsc(topicAddress);
    }

    @Override
    public Optional<Escrow> findEscrow(String escrowAddress) {
        return escrowRepository.findById(escrowAddress);
    }

    @Override
    public List<Escrow> findAllEscrows() {
        return escrowRepository.findAll();
    }

    @Override
    public List<EscrowTransfer> findTransfers(String escrowAddress) {
        return escrowTransferRepository.findByEscrowAddressOrderBySequenceAsc(escrowAddress);
    }

    @Override
    public void apply(LedgerWrite write) {
        transactionTemplate.executeWithoutResult(status -> {
            for (EscrowTransfer transfer : write.getTransfers()) {
                if (escrowTransferRepository.existsByNonce(transfer.getNonce())) {
                    throw new IllegalStateException("Duplicate escrow transfer nonce: " + transfer.getNonce());
                }
            }
            if (write.getTopic() != null) {
                topicRepository.save(write.getTopic());
            }
            if (!write.getCommitments().isEmpty()) {
                commitmentRepository.saveAll(write.getCommitments());
            }
            if (write.getEscrow() != null) {
                escrowRepository.save(write.getEscrow());
            }
            if (!write.getTransfers().isEmpty()) {
                escrowTransferRepository.insert(write.getTransfers());
            }
        });
        log.debug("Persisted ledger write: topic={}, commitments={}, transfers={}",
                write.getTopic() != null ? write.getTopic().getTopicId() : null,
                write.getCommitments().size(), write.getTransfers().size());
    }
}
