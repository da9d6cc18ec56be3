package com.flagship.custody_ledger.store;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-ledger ordered history.
 */
public interface HistoryLog {

    /**
     * @return the entry with its assigned sequence
     */
    HistoryEntry append(HistoryEntry entry);

    /**
     * Last {@code min(limit, size)} entries of the ledger, most recent first.
     */
    List<HistoryEntry> recent(UUID ledgerId, int limit);

    /**
     * Entries strictly older than {@code beforeSequence}, most recent first.
     * A null cursor starts from the newest entry.
     */
    HistoryPage page(UUID ledgerId, Long beforeSequence, int limit);

    long size(UUID ledgerId);
}
