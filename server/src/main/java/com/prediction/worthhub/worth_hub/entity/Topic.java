package com.prediction.worthhub.worth_hub.entity;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One prediction question.
 *
 * Created once by its creator, then mutated only inside an instruction:
 * commit (counters, stake), reveal (reveal count, OPEN → REVEALING),
 * finalize (truth value) and settle (terminal). Immutable once SETTLED.
 *
 * The document id is the deterministic topic address derived from
 * {@code ("topic", topicId)}.
 */
@Document(collection = "topics")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
public class Topic {

    @MongoId
    private String id;

    @Indexed(unique = true)
    private long topicId;

    private String creator;
    private String truthAuthority;
    private String description;
    private String symbol;

    /** Unix seconds; commits accepted strictly before. */
    private long commitDeadline;

    /** Unix seconds; reveals accepted strictly before, finalize at or after. */
    private long revealDeadline;

    private long minStake;

    @Builder.Default
    private TopicStatus status = TopicStatus.OPEN;

    /** Fixed-point (1e6), meaningful once FINALIZED. */
    private long truthValue;

    private long totalStake;
    private int commitmentCount;
    private int revealCount;

    public Identity creatorIdentity() {
        return Identity.fromHex(creator);
    }

    public Identity truthAuthorityIdentity() {
        return Identity.fromHex(truthAuthority);
    }

    /**
     * Move to a new status, rejecting anything the lifecycle does not allow.
     *
     * @throws IllegalStateException if the transition is invalid
     */
    public void transitionTo(TopicStatus newStatus) {
        if (!this.status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                String.format("Invalid topic state transition: %s → %s (topicId=%d)",
                    this.status, newStatus, this.topicId)
            );
        }
        this.status = newStatus;
    }

    /**
     * Account a new commitment and hand out its submit order.
     *
     * @return the zero-based submit order of the new commitment
     */
    public int recordCommitment(long stake) {
        int order = this.commitmentCount;
        try {
            this.totalStake = Math.addExact(this.totalStake, stake);
            this.commitmentCount = Math.addExact(this.commitmentCount, 1);
        } catch (ArithmeticException e) {
            throw new WorthHubException(ErrorCode.ArithmeticOverflow, e);
        }
        return order;
    }

    /**
     * Account a successful reveal. The first one opens the REVEALING phase.
     */
    public void recordReveal() {
        this.revealCount++;
        if (this.status == TopicStatus.OPEN) {
            transitionTo(TopicStatus.REVEALING);
        }
    }

    public void finalizeWith(long truthValue) {
        transitionTo(TopicStatus.FINALIZED);
        this.truthValue = truthValue;
    }

    public Topic copy() {
        return toBuilder().build();
    }
}
