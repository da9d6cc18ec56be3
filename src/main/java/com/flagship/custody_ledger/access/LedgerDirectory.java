package com.flagship.custody_ledger.access;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for ledger instances and their member sets.
 */
public interface LedgerDirectory {

    void insert(LedgerInstance ledger);

    Optional<LedgerInstance> find(UUID ledgerId);

    /**
     * Same as {@link #find} but locks the ledger row until the transaction ends.
     * Used by owner and membership changes.
     */
    Optional<LedgerInstance> findForUpdate(UUID ledgerId);

    void updateOwner(UUID ledgerId, String newOwner);

    boolean isMember(UUID ledgerId, String principal);

    /**
     * @return false if the principal was already a member
     */
    boolean addMember(UUID ledgerId, String principal, Instant addedAt);

    /**
     * @return false if the principal was not a member
     */
    boolean removeMember(UUID ledgerId, String principal);

    List<String> members(UUID ledgerId);
}
