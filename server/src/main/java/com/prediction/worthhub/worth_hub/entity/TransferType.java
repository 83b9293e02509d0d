package com.prediction.worthhub.worth_hub.entity;

public enum TransferType {
    /** Participant stake entering the vault on commit. */
    DEPOSIT,
    /** Settlement payout leaving the vault. */
    PAYOUT
}
