package com.prediction.worthhub.worth_hub.entity;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Value-holding vault paired 1:1 with a topic, addressed by
 * {@code ("vault", topicAddress)}.
 *
 * NOTE: {@code balance} is a cached value. The escrow transfer ledger is the
 * source of truth (see EscrowService).
 */
@Document(collection = "vaults")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Escrow {

    @MongoId
    private String id;

    @Indexed(unique = true)
    private String topicAddress;

    /**
     * Platform minimum balance the vault must keep; fixed when the topic is created.
     */
    private long reserve;

    private long balance;
    private long totalDeposited;
    private long totalPaidOut;

    /** Number of transfers recorded; the next transfer's sequence. */
    private long transferCount;

    private long createdAt;

    public Escrow copy() {
        return toBuilder().build();
    }
}
