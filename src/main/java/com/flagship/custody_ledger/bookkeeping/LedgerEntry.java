package com.flagship.custody_ledger.bookkeeping;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One immutable posting line. Entries are only ever inserted.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID accountId;
    BigDecimal amount;
    EntryType entryType;
    String description;
    Long sequenceNumber;
}
