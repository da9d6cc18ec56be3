package com.flagship.custody_ledger.disbursement;

import com.flagship.custody_ledger.error.TransferFailedException;
import com.flagship.custody_ledger.observability.CustodyMetrics;
import com.flagship.custody_ledger.record.CustodyRecord;
import com.flagship.custody_ledger.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * Moves value in and out of custody.
 *
 * A payout is two phases inside one transaction:
 * 1. the transitioned record (value already reduced or zeroed) is written
 * 2. the gateway is asked to send the funds
 *
 * The gateway may re-enter the service on behalf of the recipient. By then the
 * record in the store no longer authorizes a second payout. If the gateway
 * reports failure, {@link TransferFailedException} rolls back phase 1 as well.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisbursementService {

    private final RecordStore recordStore;
    private final ValueTransferGateway gateway;
    private final CustodyMetrics metrics;
    private final Clock clock;

    /**
     * @param settled the record after its transition; persisted before any funds move
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransferResult payout(CustodyRecord settled, BigDecimal amount, String recipient) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Payout amount must be positive: " + amount);
        }

        recordStore.update(settled);
        return send(settled, amount, recipient);
    }

    /**
     * Value that only passes through custody: the settled record is written, the
     * payer's funds are taken in and the same amount goes straight out to the payee.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransferResult passThrough(CustodyRecord settled, String payer, String payee, BigDecimal amount) {
        recordStore.update(settled);
        acceptDeposit(settled.getLedgerId(), settled.getKey(), payer, amount);
        return send(settled, amount, payee);
    }

    /**
     * Takes the value attached to a call into the ledger's custody.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransferResult acceptDeposit(UUID ledgerId, String recordKey, String payer, BigDecimal amount) {
        String memo = String.format("deposit %s/%s", ledgerId, recordKey);
        TransferResult result = gateway.receive(ledgerId, payer, amount, memo);
        if (!result.isSucceeded()) {
            metrics.recordTransferFailure("in");
            log.error("Deposit failed: ledgerId={}, key={}, payer={}, amount={}, reason={}",
                    ledgerId, recordKey, payer, amount, result.getFailureReason());
            throw new TransferFailedException(payer, amount, result.getFailureReason());
        }

        metrics.recordValueMoved("in", amount);
        log.debug("Accepted deposit of {} from {} for {}", amount, payer, recordKey);
        return result;
    }

    @Transactional(readOnly = true)
    public ReconciliationReport reconcile(UUID ledgerId) {
        ReconciliationReport report = new ReconciliationReport(
                ledgerId,
                recordStore.sumValue(ledgerId),
                gateway.custodyBalance(ledgerId),
                clock.instant());

        metrics.recordReconciliation(report.isBalanced());
        if (!report.isBalanced()) {
            log.error("Custody mismatch: ledgerId={}, recorded={}, substrate={}",
                    ledgerId, report.getRecordedValue(), report.getCustodyBalance());
        }
        return report;
    }

    private TransferResult send(CustodyRecord settled, BigDecimal amount, String recipient) {
        String memo = String.format("payout %s/%s", settled.getLedgerId(), settled.getKey());
        TransferResult result = gateway.transfer(settled.getLedgerId(), recipient, amount, memo);
        if (!result.isSucceeded()) {
            metrics.recordTransferFailure("out");
            log.error("Payout failed: ledgerId={}, key={}, recipient={}, amount={}, reason={}",
                    settled.getLedgerId(), settled.getKey(), recipient, amount, result.getFailureReason());
            throw new TransferFailedException(recipient, amount, result.getFailureReason());
        }

        metrics.recordValueMoved("out", amount);
        log.info("Paid out {} to {} from {}: tx={}", amount, recipient, settled.getKey(), result.getTransactionId());
        return result;
    }
}
