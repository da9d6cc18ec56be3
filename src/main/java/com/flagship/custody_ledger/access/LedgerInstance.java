package com.flagship.custody_ledger.access;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One hosted ledger: a kind, a single owner and its own records and history.
 */
@Value
public class LedgerInstance {
    UUID id;
    LedgerKind kind;
    String name;
    String owner;
    Instant createdAt;

    public static LedgerInstance open(LedgerKind kind, String name, String owner, Instant now) {
        return new LedgerInstance(UUID.randomUUID(), kind, name, owner, now);
    }

    public boolean isOwner(String principal) {
        return owner.equals(principal);
    }

    public LedgerInstance withOwner(String newOwner) {
        return new LedgerInstance(id, kind, name, newOwner, createdAt);
    }
}
