package com.flagship.custody_ledger.record;

import com.flagship.custody_ledger.access.Privilege;

/**
 * Kinds of records the engine keeps custody of.
 *
 * A monetary kind holds custodied value that is paid out at most once.
 * An RSVP stays with the attendee it was issued to, since check-in pays the
 * beneficiary and a withdrawal looks the seat up by the caller.
 */
public enum RecordKind {
    WARRANTY(false, Privilege.OWNER, true, true),
    REGISTRY_ITEM(false, Privilege.OWNER, true, true),
    GIFT_CARD(true, Privilege.OPEN, true, true),
    TREASURY_POOL(true, Privilege.OPEN, false, false),
    EVENT(false, Privilege.OWNER, true, true),
    RSVP(true, Privilege.OPEN, false, false);

    private final boolean monetary;
    private final Privilege creationPrivilege;
    private final boolean voidable;
    private final boolean transferable;

    RecordKind(boolean monetary, Privilege creationPrivilege, boolean voidable, boolean transferable) {
        this.monetary = monetary;
        this.creationPrivilege = creationPrivilege;
        this.voidable = voidable;
        this.transferable = transferable;
    }

    public boolean isMonetary() {
        return monetary;
    }

    public Privilege getCreationPrivilege() {
        return creationPrivilege;
    }

    public boolean isVoidable() {
        return voidable;
    }

    public boolean isTransferable() {
        return transferable;
    }
}
