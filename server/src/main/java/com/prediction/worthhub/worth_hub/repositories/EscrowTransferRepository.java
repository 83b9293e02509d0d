package com.prediction.worthhub.worth_hub.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.worthhub.worth_hub.entity.EscrowTransfer;

@Repository
public interface EscrowTransferRepository extends MongoRepository<EscrowTransfer, String> {

    /**
     * Full ledger of one escrow in sequence order.
     * Used for reconciliation; O(n).
     */
    List<EscrowTransfer> findByEscrowAddressOrderBySequenceAsc(String escrowAddress);

    /**
     * Check if a transfer with the given nonce was already recorded.
     */
    boolean existsByNonce(String nonce);
}
