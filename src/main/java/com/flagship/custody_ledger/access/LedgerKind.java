package com.flagship.custody_ledger.access;

import com.flagship.custody_ledger.record.RecordKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * The five custodial ledger variants. Each accepts a fixed set of record kinds.
 */
public enum LedgerKind {
    WARRANTY_REGISTRY(EnumSet.of(RecordKind.WARRANTY)),
    GIFT_REGISTRY(EnumSet.of(RecordKind.REGISTRY_ITEM)),
    GIFT_CARDS(EnumSet.of(RecordKind.GIFT_CARD)),
    SHARED_TREASURY(EnumSet.of(RecordKind.TREASURY_POOL)),
    EVENT_ESCROW(EnumSet.of(RecordKind.EVENT, RecordKind.RSVP));

    private final Set<RecordKind> recordKinds;

    LedgerKind(Set<RecordKind> recordKinds) {
        this.recordKinds = recordKinds;
    }

    public boolean accepts(RecordKind kind) {
        return recordKinds.contains(kind);
    }
}
