package com.flagship.custody_ledger.access;

/**
 * Who may perform an operation on a ledger.
 */
public enum Privilege {
    /** Only the ledger owner. */
    OWNER,
    /** The owner or any principal the owner added as member. */
    OWNER_OR_MEMBER,
    /** Any identified caller. */
    OPEN
}
