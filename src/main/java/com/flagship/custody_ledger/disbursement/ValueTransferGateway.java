package com.flagship.custody_ledger.disbursement;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The substrate that actually moves value in and out of custody.
 *
 * Implementations may hand control to the recipient during {@link #transfer}
 * (a callback, a webhook, a nested call back into this service). Callers must
 * therefore have written every effect of the operation before calling it.
 */
public interface ValueTransferGateway {

    /**
     * Takes {@code amount} from {@code payer} into the ledger's custody.
     */
    TransferResult receive(UUID ledgerId, String payer, BigDecimal amount, String memo);

    /**
     * Sends {@code amount} out of the ledger's custody to {@code recipient}.
     * A failed result means nothing moved.
     */
    TransferResult transfer(UUID ledgerId, String recipient, BigDecimal amount, String memo);

    /**
     * What the substrate believes it currently holds for the ledger.
     */
    BigDecimal custodyBalance(UUID ledgerId);
}
