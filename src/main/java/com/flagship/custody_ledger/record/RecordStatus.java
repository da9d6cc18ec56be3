package com.flagship.custody_ledger.record;

/**
 * Status of a custody record.
 *
 * ACTIVE and TRANSFERRED form the active super-state: a record can change hands
 * any number of times without leaving it. Every other status is terminal.
 *
 * EXPIRED is never written by a scheduled job. It is derived at read or transition
 * time from the record's expiry and the clock.
 */
public enum RecordStatus {
    ACTIVE,
    TRANSFERRED,
    VOIDED,
    REDEEMED,
    EXPIRED,
    CANCELLED;

    public boolean isActiveState() {
        return this == ACTIVE || this == TRANSFERRED;
    }

    public boolean isTerminal() {
        return !isActiveState();
    }
}
