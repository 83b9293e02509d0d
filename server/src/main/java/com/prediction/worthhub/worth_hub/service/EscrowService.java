package com.prediction.worthhub.worth_hub.service;

import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.worthhub.worth_hub.entity.Commitment;
import com.prediction.worthhub.worth_hub.entity.Escrow;
import com.prediction.worthhub.worth_hub.entity.EscrowTransfer;
import com.prediction.worthhub.worth_hub.entity.TransferType;
import com.prediction.worthhub.worth_hub.error.ErrorCode;
import com.prediction.worthhub.worth_hub.error.WorthHubException;
import com.prediction.worthhub.worth_hub.ledger.LedgerStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Escrow bookkeeping.
 *
 * The transfer ledger is the SOURCE OF TRUTH for vault balances.
 * {@link Escrow#getBalance()} is a cached value updated in the same ledger
 * write as the transfer that changes it. Only settlement moves value out.
 */
@Slf4j
@RequiredArgsConstructor
public class EscrowService {

    private final LedgerStore ledgerStore;

    public Escrow open(String escrowAddress, String topicAddress, long reserve, long now) {
        return Escrow.builder()
                .id(escrowAddress)
                .topicAddress(topicAddress)
                .reserve(reserve)
                .createdAt(now)
                .build();
    }

    /**
     * Record a stake entering the vault. Mutates {@code escrow}.
     */
    public EscrowTransfer deposit(Escrow escrow, Commitment commitment, long now) {
        long amount = commitment.getStakeAmount();
        try {
            escrow.setBalance(Math.addExact(escrow.getBalance(), amount));
            escrow.setTotalDeposited(Math.addExact(escrow.getTotalDeposited(), amount));
        } catch (ArithmeticException e) {
            throw new WorthHubException(ErrorCode.ArithmeticOverflow, e);
        }
        return record(escrow, commitment, TransferType.DEPOSIT, amount, now);
    }

    /**
     * Record a settlement payout leaving the vault. Mutates {@code escrow}.
     *
     * @throws IllegalStateException if the payout would dip into the reserve
     */
    public EscrowTransfer payout(Escrow escrow, Commitment commitment, long amount, long now) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Payout must be positive: " + amount);
        }
        long distributable = escrow.getBalance() - Math.min(escrow.getReserve(), escrow.getTotalDeposited());
        if (amount > distributable) {
            throw new IllegalStateException(String.format(
                    "Payout %d exceeds distributable escrow balance %d (escrow=%s)",
                    amount, distributable, escrow.getId()));
        }
        escrow.setBalance(escrow.getBalance() - amount);
        escrow.setTotalPaidOut(escrow.getTotalPaidOut() + amount);
        return record(escrow, commitment, TransferType.PAYOUT, amount, now);
    }

    private EscrowTransfer record(Escrow escrow, Commitment commitment, TransferType type, long amount, long now) {
        long sequence = escrow.getTransferCount();
        escrow.setTransferCount(sequence + 1);
        return EscrowTransfer.builder()
                .id(escrow.getId() + ":" + sequence)
                .nonce(nonce(commitment.getId(), type))
                .escrowAddress(escrow.getId())
                .topicAddress(escrow.getTopicAddress())
                .participant(commitment.getParticipant())
                .type(type)
                .amount(amount)
                .sequence(sequence)
                .balanceAfter(escrow.getBalance())
                .timestamp(now)
                .build();
    }

    public static String nonce(String commitmentAddress, TransferType type) {
        return commitmentAddress + ":" + type.name().toLowerCase();
    }

    /**
     * Balance according to the latest transfer's running balance.
     */
    public long computeBalanceFromLedger(String escrowAddress) {
        List<EscrowTransfer> transfers = ledgerStore.findTransfers(escrowAddress);
        if (transfers.isEmpty()) {
            return 0L;
        }
        return transfers.get(transfers.size() - 1).getBalanceAfter();
    }

    /**
     * Balance by summing every transfer. O(n); auditing only.
     */
    public long computeBalanceFromLedgerFullScan(String escrowAddress) {
        long balance = 0L;
        for (EscrowTransfer transfer : ledgerStore.findTransfers(escrowAddress)) {
            balance += transfer.signedAmount();
        }
        return balance;
    }

    /**
     * Periodic audit: the cached vault balance must match the transfer ledger.
     * Drift is reported, never repaired, since escrow records are only written
     * by instructions.
     *
     * @return number of escrows whose cached balance drifted
     */
    @Scheduled(fixedDelayString = "${worthhub.escrow.reconcile-interval-ms:300000}")
    public int reconcileAllEscrows() {
        log.info("Starting escrow reconciliation from transfer ledger...");

        int checked = 0;
        int drifted = 0;
        for (Escrow escrow : ledgerStore.findAllEscrows()) {
            long ledgerBalance = computeBalanceFromLedgerFullScan(escrow.getId());
            if (ledgerBalance != escrow.getBalance()) {
                log.warn("Escrow balance drift detected for {}: cached={}, ledger={}",
                        escrow.getId(), escrow.getBalance(), ledgerBalance);
                drifted++;
            }
            checked++;
        }

        log.info("Escrow reconciliation complete: {} escrows checked, {} drifted", checked, drifted);
        return drifted;
    }
}
