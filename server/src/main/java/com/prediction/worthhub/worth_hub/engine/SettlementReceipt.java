package com.prediction.worthhub.worth_hub.engine;

import com.prediction.worthhub.worth_hub.entity.TopicStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one settle call.
 */
@Getter
@Builder
@AllArgsConstructor
public class SettlementReceipt {

    private final SettlementPlan plan;

    /** Commitments marked settled by this call (earlier calls excluded). */
    private final int commitmentsSettled;

    /** Value transferred out of the escrow by this call. */
    private final long amountPaid;

    /** Number of ledger writes this call needed. */
    private final int ledgerWrites;

    private final TopicStatus status;
}
