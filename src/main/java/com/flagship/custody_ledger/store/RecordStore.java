package com.flagship.custody_ledger.store;

import com.flagship.custody_ledger.record.CustodyRecord;
import com.flagship.custody_ledger.record.RecordKind;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keyed record mapping, one namespace per ledger.
 *
 * Absence is always an empty Optional. A record holding zero value is a record,
 * not a missing one.
 */
public interface RecordStore {

    Optional<CustodyRecord> find(UUID ledgerId, String key);

    /**
     * Locks the record row until the transaction ends. Concurrent transitions
     * on the same key queue behind the lock and then see the committed state.
     */
    Optional<CustodyRecord> findForUpdate(UUID ledgerId, String key);

    /**
     * @return false if the key is already taken in this ledger
     */
    boolean insert(CustodyRecord record);

    /**
     * Writes a transitioned record. The stored version must be exactly one behind.
     *
     * @throws org.springframework.dao.OptimisticLockingFailureException on a stale record
     */
    void update(CustodyRecord record);

    /**
     * Records of a kind, in creation order. A non-null {@code parentKey} narrows
     * the page to the children of that record.
     */
    List<CustodyRecord> page(UUID ledgerId, RecordKind kind, String parentKey, int offset, int limit);

    /**
     * Total value held across every record of the ledger.
     */
    BigDecimal sumValue(UUID ledgerId);
}
