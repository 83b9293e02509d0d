package com.prediction.worthhub.worth_hub.entity;

/**
 * Topic lifecycle. Linear, no cycles, no skipping:
 *
 * OPEN      → REVEALING  (first successful reveal)
 * OPEN      → FINALIZED  (truth submitted, nobody revealed)
 * REVEALING → FINALIZED  (truth submitted)
 * FINALIZED → SETTLED    (payouts executed)
 *
 * SETTLED is terminal. The numeric code is the persisted wire value.
 */
public enum TopicStatus {

    OPEN(0),
    REVEALING(1),
    FINALIZED(2),
    SETTLED(3);

    private final int code;

    TopicStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static TopicStatus fromCode(int code) {
        for (TopicStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown topic status code: " + code);
    }

    public boolean isTerminal() {
        return this == SETTLED;
    }

    /**
     * Reveals are still accepted (deadline permitting).
     */
    public boolean acceptsReveals() {
        return this == OPEN || this == REVEALING;
    }

    public boolean canTransitionTo(TopicStatus to) {
        return switch (this) {
            case OPEN -> to == REVEALING || to == FINALIZED;
            case REVEALING -> to == FINALIZED;
            case FINALIZED -> to == SETTLED;
            case SETTLED -> false;
        };
    }
}
