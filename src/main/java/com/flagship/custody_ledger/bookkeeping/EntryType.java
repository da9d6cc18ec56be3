package com.flagship.custody_ledger.bookkeeping;

/**
 * Side of a double-entry posting.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
