package com.flagship.custody_ledger.event;

/**
 * Every committed transition produces exactly one event of one of these kinds.
 * The name doubles as the action recorded in history.
 */
public enum EventKind {
    RECORD_CREATED,
    RECORD_TRANSFERRED,
    RECORD_VOIDED,
    RECORD_REDEEMED,
    RECORD_CANCELLED,
    MEMBERSHIP_CHANGED,
    OWNERSHIP_TRANSFERRED,
    FUNDS_DEPOSITED,
    FUNDS_WITHDRAWN
}
