package com.flagship.custody_ledger.access;

import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.event.EventKind;
import com.flagship.custody_ledger.event.TransitionJournal;
import com.flagship.custody_ledger.identity.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Per-ledger authorization: one owner, plus a member set only the owner manages.
 *
 * Every check here runs before the guarded operation writes anything.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessControlService {

    static final String MEMBER_ADDED = "member added";
    static final String MEMBER_REMOVED = "member removed";

    private final LedgerDirectory directory;
    private final TransitionJournal journal;
    private final Clock clock;

    @Transactional
    public LedgerInstance openLedger(CallerContext caller, LedgerKind kind, String name) {
        if (kind == null) {
            throw CustodyRejectedException.invalidInput("Ledger kind is required");
        }
        if (name == null || name.isBlank()) {
            throw CustodyRejectedException.invalidInput("Ledger name is required");
        }
        LedgerInstance ledger = LedgerInstance.open(kind, name.trim(), caller.getPrincipal(), clock.instant());
        directory.insert(ledger);
        log.info("Opened ledger: ledgerId={}, kind={}, owner={}", ledger.getId(), kind, ledger.getOwner());
        return ledger;
    }

    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public LedgerInstance getLedger(UUID ledgerId) {
        return directory.find(ledgerId)
                .orElseThrow(() -> CustodyRejectedException.notFound("Ledger not found: " + ledgerId));
    }

    /**
     * @return the ledger, once the caller is known to hold {@code privilege} on it
     */
    public LedgerInstance require(UUID ledgerId, CallerContext caller, Privilege privilege) {
        return switch (privilege) {
            case OWNER -> requireOwner(ledgerId, caller);
            case OWNER_OR_MEMBER -> requireOwnerOrMember(ledgerId, caller);
            case OPEN -> getLedger(ledgerId);
        };
    }

    public LedgerInstance requireOwner(UUID ledgerId, CallerContext caller) {
        LedgerInstance ledger = getLedger(ledgerId);
        if (!ledger.isOwner(caller.getPrincipal())) {
            throw CustodyRejectedException.unauthorized(
                    String.format("%s is not the owner of ledger %s", caller.getPrincipal(), ledgerId));
        }
        return ledger;
    }

    public LedgerInstance requireOwnerOrMember(UUID ledgerId, CallerContext caller) {
        LedgerInstance ledger = getLedger(ledgerId);
        if (!ledger.isOwner(caller.getPrincipal()) && !directory.isMember(ledgerId, caller.getPrincipal())) {
            throw CustodyRejectedException.unauthorized(
                    String.format("%s is neither owner nor member of ledger %s", caller.getPrincipal(), ledgerId));
        }
        return ledger;
    }

    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public boolean isMember(UUID ledgerId, String principal) {
        getLedger(ledgerId);
        return principal != null && directory.isMember(ledgerId, principal);
    }

    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public List<String> members(UUID ledgerId) {
        getLedger(ledgerId);
        return directory.members(ledgerId);
    }

    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public void addMember(UUID ledgerId, CallerContext caller, String principal) {
        LedgerInstance ledger = requireOwner(ledgerId, caller);
        String member = requirePrincipal(principal, "Member");
        if (ledger.isOwner(member)) {
            throw CustodyRejectedException.invalidState(member + " owns the ledger and cannot be added as member");
        }
        if (!directory.addMember(ledgerId, member, clock.instant())) {
            throw CustodyRejectedException.invalidState(member + " is already a member");
        }
        journal.record(ledgerId, null, EventKind.MEMBERSHIP_CHANGED, caller.getPrincipal(), member, null, MEMBER_ADDED);
        log.info("Member added: ledgerId={}, member={}", ledgerId, member);
    }

    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public void removeMember(UUID ledgerId, CallerContext caller, String principal) {
        requireOwner(ledgerId, caller);
        String member = requirePrincipal(principal, "Member");
        if (!directory.removeMember(ledgerId, member)) {
            throw CustodyRejectedException.invalidState(member + " is not a member");
        }
        journal.record(ledgerId, null, EventKind.MEMBERSHIP_CHANGED, caller.getPrincipal(), member, null, MEMBER_REMOVED);
        log.info("Member removed: ledgerId={}, member={}", ledgerId, member);
    }

    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public LedgerInstance transferOwnership(UUID ledgerId, CallerContext caller, String newOwner) {
        requireOwner(ledgerId, caller);
        LedgerInstance ledger = directory.findForUpdate(ledgerId)
                .orElseThrow(() -> CustodyRejectedException.notFound("Ledger not found: " + ledgerId));
        if (!ledger.isOwner(caller.getPrincipal())) {
            throw CustodyRejectedException.unauthorized(caller.getPrincipal() + " is no longer the owner");
        }
        String successor = requirePrincipal(newOwner, "New owner");
        if (ledger.isOwner(successor)) {
            throw CustodyRejectedException.invalidInput(successor + " already owns the ledger");
        }
        directory.updateOwner(ledgerId, successor);
        journal.record(ledgerId, null, EventKind.OWNERSHIP_TRANSFERRED, caller.getPrincipal(), successor, null, null);
        log.info("Ownership transferred: ledgerId={}, from={}, to={}", ledgerId, caller.getPrincipal(), successor);
        return ledger.withOwner(successor);
    }

    private static String requirePrincipal(String principal, String label) {
        if (principal == null || principal.isBlank()) {
            throw CustodyRejectedException.invalidInput(label + " principal is required");
        }
        return principal.trim();
    }
}
