package com.flagship.custody_ledger.disbursement;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome reported by a {@link ValueTransferGateway}.
 */
@Value
public class TransferResult {
    boolean succeeded;
    UUID transactionId;
    String failureReason;

    public static TransferResult succeeded(UUID transactionId) {
        return new TransferResult(true, transactionId, null);
    }

    public static TransferResult failed(String reason) {
        return new TransferResult(false, null, reason);
    }
}
