package com.prediction.worthhub.worth_hub.ledger;

import java.util.List;

import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Escrow;
import com.prediction.worthhub.worth_hub.entity.EscrowTransfer;
import com.prediction.worthhub.worth_hub.entity.Topic;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Every record an instruction changes. Applied all-or-nothing.
 */
@Getter
@Builder
public class LedgerWrite {

    private final Topic topic;

    @Singular
    private final List<Commitment> commitments;

    private final Escrow escrow;

    @Singular
    private final List<EscrowTransfer> transfers;
}
