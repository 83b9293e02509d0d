package com.prediction.worthhub.worth_hub.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A participant's hash-locked prediction plus stake, one per (topic, participant).
 *
 * The document id is derived from {@code ("commitment", topicAddress, participant)},
 * so a second commit by the same participant lands on the same address.
 * Commitments are never deleted.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "commitments")
@CompoundIndex(name = "topic_participant_idx", def = "{'topicAddress':1,'participant':1}", unique = true)
@CompoundIndex(name = "topic_order_idx", def = "{'topicAddress':1,'submitOrder':1}", unique = true)
public class Commitment {

    @MongoId
    private String id;

    private String topicAddress;
    private String participant;

    /**
     * keccak256(prediction_le || salt || participant).
     */
    private byte[] commitmentHash;

    private long stakeAmount;

    /**
     * Zero-based position among the topic's commitments; the timing signal.
     */
    private int submitOrder;

    /** Fixed-point (1e6), populated on reveal. */
    private long predictionValue;

    private boolean revealed;

    /** Set once this participant's payout has been executed. */
    private boolean settled;

    public Identity participantIdentity() {
        return Identity.fromHex(participant);
    }

    public void reveal(long predictionValue) {
        if (this.revealed) {
            throw new IllegalStateException("Commitment already revealed: " + id);
        }
        this.predictionValue = predictionValue;
        this.revealed = true;
    }

    public void markSettled() {
        if (this.settled) {
            throw new IllegalStateException("Commitment already settled: " + id);
        }
        this.settled = true;
    }

    public Commitment copy() {
        return toBuilder()
                .commitmentHash(commitmentHash != null ? commitmentHash.clone() : null)
                .build();
    }
}
