package com.prediction.worthhub.worth_hub.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "escrow_transfers")
@CompoundIndex(name = "escrow_sequence_idx", def = "{'escrowAddress':1,'sequence':1}", unique = true)
public class EscrowTransfer {

    @MongoId
    private String id;

    /**
     * Deterministic idempotency key: {commitmentAddress}:{deposit|payout}.
     * The unique index makes a second payout to the same commitment impossible.
     */
    @Indexed(unique = true)
    private String nonce;

    @Indexed
    private String escrowAddress;

    private String topicAddress;
    private String participant;

    private TransferType type;

    /** Always positive; the type gives the direction. */
    private long amount;

    /** Position in this escrow's ledger, starting at 0. */
    private long sequence;

    /**
     * Vault balance after this transfer.
     * balanceAfter = balanceBefore ± amount
     */
    private long balanceAfter;

    private long timestamp;

    /**
     * Signed effect on the vault balance.
     */
    public long signedAmount() {
        return type == TransferType.DEPOSIT ? amount : -amount;
    }

    public EscrowTransfer copy() {
        return toBuilder().build();
    }
}
