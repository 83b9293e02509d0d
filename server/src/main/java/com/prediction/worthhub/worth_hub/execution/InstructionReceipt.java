package com.prediction.worthhub.worth_hub.execution;

import com.prediction.worthhub.worth_hub.engine.SettlementReceipt;
import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Topic;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * State after a successfully executed instruction.
 */
@Getter
@Builder
@AllArgsConstructor
public class InstructionReceipt {

    private final InstructionType type;
    private final Topic topic;

    /** Set for COMMIT and REVEAL. */
    private final Commitment commitment;

    /** Set for SETTLE. */
    private final SettlementReceipt settlement;
}
