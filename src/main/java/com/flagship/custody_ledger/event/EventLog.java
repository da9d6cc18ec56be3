package com.flagship.custody_ledger.event;

/**
 * Sink for ledger events. Implementations must take part in the caller's
 * transaction: an event is only observable if the transition committed.
 */
public interface EventLog {

    void emit(LedgerEvent event);
}
