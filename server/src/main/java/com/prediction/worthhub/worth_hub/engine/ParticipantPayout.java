package com.prediction.worthhub.worth_hub.engine;

import java.math.BigInteger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * One line of a settlement plan.
 */
@Getter
@Builder
@AllArgsConstructor
public class ParticipantPayout {

    private final String commitmentAddress;
    private final String participant;
    private final int submitOrder;
    private final long stake;
    private final boolean revealed;
    private final long predictionValue;

    /** prediction − consensus; 0 for non-revealers. */
    private final BigInteger edge;

    /** Deviation from consensus points the same way as the truth did. */
    private final boolean aligned;

    private final long accuracyWeight;
    private final long timeDecayWeight;
    private final BigInteger score;

    /** Share of the loser pool (after reserve). */
    private final long bonus;

    /** Total amount leaving the escrow for this participant. */
    private final long payout;
}
