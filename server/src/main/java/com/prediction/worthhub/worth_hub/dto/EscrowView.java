package com.prediction.worthhub.worth_hub.dto;

import com.prediction.worthhub.worth_hub.entity.Escrow;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@AllArgsConstructor
public class EscrowView {

    private final String address;
    private final String topicAddress;
    private final long balance;
    private final long reserve;
    private final long totalDeposited;
    private final long totalPaidOut;
    private final long transferCount;

    public static EscrowView from(Escrow escrow) {
        return EscrowView.builder()
                .address(escrow.getId())
                .topicAddress(escrow.getTopicAddress())
                .balance(escrow.getBalance())
                .reserve(escrow.getReserve())
                .totalDeposited(escrow.getTotalDeposited())
                .totalPaidOut(escrow.getTotalPaidOut())
                .transferCount(escrow.getTransferCount())
                .build();
    }
}
