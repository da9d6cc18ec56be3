package com.flagship.custody_ledger.error;

import java.math.BigDecimal;

/**
 * The value-transfer substrate reported that an outbound transfer did not happen.
 *
 * Unlike {@link CustodyRejectedException} this rolls back the whole operation:
 * the effects written before the transfer, the history entry and the outbox event
 * are all discarded together. Never retried internally.
 */
public class TransferFailedException extends RuntimeException {

    private final String recipient;
    private final BigDecimal amount;

    public TransferFailedException(String recipient, BigDecimal amount, String reason) {
        super(String.format("Transfer of %s to %s failed: %s", amount, recipient, reason));
        this.recipient = recipient;
        this.amount = amount;
    }

    public CustodyError getError() {
        return CustodyError.TRANSFER_FAILED;
    }

    public String getRecipient() {
        return recipient;
    }

    public BigDecimal getAmount() {
        return amount;
    }
}
