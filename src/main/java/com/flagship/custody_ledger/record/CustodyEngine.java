package com.flagship.custody_ledger.record;

import com.flagship.custody_ledger.access.AccessControlService;
import com.flagship.custody_ledger.access.LedgerInstance;
import com.flagship.custody_ledger.access.Privilege;
import com.flagship.custody_ledger.disbursement.DisbursementService;
import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.event.EventKind;
import com.flagship.custody_ledger.event.TransitionJournal;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.store.HistoryEntry;
import com.flagship.custody_ledger.store.HistoryLog;
import com.flagship.custody_ledger.store.HistoryPage;
import com.flagship.custody_ledger.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Guarded transitions over custody records.
 *
 * Every operation follows the same order inside one transaction:
 * 1. authorize the caller against the ledger
 * 2. check preconditions against the stored record and the clock
 * 3. write the transitioned record
 * 4. move funds, if the transition releases or takes any
 * 5. append history and emit the event
 *
 * Steps 1 and 2 throw {@link CustodyRejectedException} and never write. A failed
 * transfer in step 4 rolls back step 3 with it.
 */
@Service
@Slf4j
public class CustodyEngine {

    public static final String POOL_KEY = "pool";
    static final int MAX_KEY_LENGTH = 200;

    private final AccessControlService accessControl;
    private final RecordStore recordStore;
    private final HistoryLog historyLog;
    private final DisbursementService disbursement;
    private final TransitionJournal journal;
    private final Clock clock;
    private final int maxPageSize;

    public CustodyEngine(AccessControlService accessControl,
                         RecordStore recordStore,
                         HistoryLog historyLog,
                         DisbursementService disbursement,
                         TransitionJournal journal,
                         Clock clock,
                         @Value("${custody.history.max-page-size:100}") int maxPageSize) {
        this.accessControl = accessControl;
        this.recordStore = recordStore;
        this.historyLog = historyLog;
        this.disbursement = disbursement;
        this.journal = journal;
        this.clock = clock;
        this.maxPageSize = maxPageSize;
    }

    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord create(UUID ledgerId, CallerContext caller, NewRecord request) {
        RecordKind kind = request.getKind();
        if (kind == null) {
            throw CustodyRejectedException.invalidInput("Record kind is required");
        }
        LedgerInstance ledger = accessControl.require(ledgerId, caller, kind.getCreationPrivilege());
        if (!ledger.getKind().accepts(kind) || kind == RecordKind.RSVP || kind == RecordKind.TREASURY_POOL) {
            throw CustodyRejectedException.invalidInput(
                    String.format("A %s ledger does not create %s records this way", ledger.getKind(), kind));
        }

        Instant now = clock.instant();
        validateNewRecord(request, caller, now);
        requireKeyFree(ledgerId, request.getKey());

        CustodyRecord record = CustodyRecord.open(ledgerId, request, caller.getPrincipal(), now);
        if (!recordStore.insert(record)) {
            throw CustodyRejectedException.alreadyExists("Key already used: " + request.getKey());
        }
        if (kind.isMonetary()) {
            disbursement.acceptDeposit(ledgerId, record.getKey(), caller.getPrincipal(), record.getValue());
        }

        journal.record(ledgerId, record.getKey(), EventKind.RECORD_CREATED, caller.getPrincipal(),
                record.getBeneficiary(), kind.isMonetary() ? record.getValue() : null, null);
        return record;
    }

    /**
     * Hands the record to a new beneficiary. Only the current beneficiary may do this,
     * and only while the record is unexpired and unsettled.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord transfer(UUID ledgerId, CallerContext caller, String key, String newBeneficiary) {
        accessControl.getLedger(ledgerId);
        CustodyRecord record = lockRecord(ledgerId, key);
        if (!record.getKind().isTransferable()) {
            throw CustodyRejectedException.invalidState(record.getKind() + " records cannot be transferred");
        }
        if (!caller.is(record.getBeneficiary())) {
            throw CustodyRejectedException.unauthorized(
                    String.format("%s is not the beneficiary of %s", caller.getPrincipal(), key));
        }
        if (newBeneficiary == null || newBeneficiary.isBlank()) {
            throw CustodyRejectedException.invalidInput("New beneficiary is required");
        }
        String successor = newBeneficiary.trim();
        if (successor.equals(record.getBeneficiary())) {
            throw CustodyRejectedException.invalidInput(successor + " already holds " + key);
        }

        CustodyRecord transferred = record.transferTo(successor, clock.instant());
        recordStore.update(transferred);

        journal.record(ledgerId, key, EventKind.RECORD_TRANSFERRED, caller.getPrincipal(), successor, null, null);
        return transferred;
    }

    /**
     * Owner flags a record as void. Irreversible, pays nobody, works on expired records.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord voidRecord(UUID ledgerId, CallerContext caller, String key, String reason) {
        accessControl.requireOwner(ledgerId, caller);
        CustodyRecord record = lockRecord(ledgerId, key);
        if (!record.getKind().isVoidable()) {
            throw CustodyRejectedException.invalidState(record.getKind() + " records cannot be voided");
        }
        if (reason == null || reason.isBlank()) {
            throw CustodyRejectedException.invalidInput("Void reason is required");
        }

        CustodyRecord voided = record.voidRecord(reason.trim(), clock.instant());
        recordStore.update(voided);

        journal.record(ledgerId, key, EventKind.RECORD_VOIDED, caller.getPrincipal(),
                record.getBeneficiary(), null, voided.getClosingNote());
        return voided;
    }

    /**
     * Redeems the record whose key is the commitment of {@code secret}, paying the caller.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord redeemBySecret(UUID ledgerId, CallerContext caller, String secret, String note) {
        accessControl.getLedger(ledgerId);
        String key = Commitments.commit(secret);
        CustodyRecord record = recordStore.findForUpdate(ledgerId, key)
                .orElseThrow(() -> CustodyRejectedException.notFound("No record matches the supplied secret"));
        return redeem(record, caller.getPrincipal(), caller, note);
    }

    /**
     * Redeems a record on behalf of its designated beneficiary, paying the beneficiary.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord redeemAsBeneficiary(UUID ledgerId, CallerContext caller, String key, String note) {
        accessControl.getLedger(ledgerId);
        CustodyRecord record = lockRecord(ledgerId, key);
        if (!caller.is(record.getBeneficiary())) {
            throw CustodyRejectedException.unauthorized(
                    String.format("%s is not the beneficiary of %s", caller.getPrincipal(), key));
        }
        return redeem(record, record.getBeneficiary(), caller, note);
    }

    /**
     * Depositor takes the funds back. Allowed after expiry.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord cancel(UUID ledgerId, CallerContext caller, String key) {
        accessControl.getLedger(ledgerId);
        CustodyRecord record = lockRecord(ledgerId, key);
        if (!caller.is(record.getDepositor())) {
            throw CustodyRejectedException.unauthorized(
                    String.format("Only the depositor can cancel %s", key));
        }
        if (record.getKind() != RecordKind.GIFT_CARD) {
            throw CustodyRejectedException.invalidState(record.getKind() + " records cannot be cancelled");
        }

        BigDecimal amount = record.getValue();
        CustodyRecord cancelled = record.cancel(clock.instant());
        disbursement.payout(cancelled, amount, record.getDepositor());

        journal.record(ledgerId, key, EventKind.RECORD_CANCELLED, caller.getPrincipal(),
                record.getDepositor(), amount, null);
        return cancelled;
    }

    /**
     * Buys a registry item. The attached value must equal the price exactly; it
     * is paid straight through to the current ledger owner.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord purchase(UUID ledgerId, CallerContext caller, String key) {
        LedgerInstance ledger = accessControl.getLedger(ledgerId);
        CustodyRecord record = lockRecord(ledgerId, key);
        if (record.getKind() != RecordKind.REGISTRY_ITEM) {
            throw CustodyRejectedException.invalidState(key + " is not for sale");
        }
        requireExactValue(caller, record.getUnitAmount());

        CustodyRecord purchased = record.purchase(caller.getPrincipal(), clock.instant());
        disbursement.passThrough(purchased, caller.getPrincipal(), ledger.getOwner(), record.getUnitAmount());

        journal.record(ledgerId, key, EventKind.RECORD_REDEEMED, caller.getPrincipal(),
                ledger.getOwner(), record.getUnitAmount(), "purchased");
        return purchased;
    }

    /**
     * Adds the attached value to the ledger's pool, opening the pool on first deposit.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord deposit(UUID ledgerId, CallerContext caller, String note) {
        LedgerInstance ledger = accessControl.getLedger(ledgerId);
        if (!ledger.getKind().accepts(RecordKind.TREASURY_POOL)) {
            throw CustodyRejectedException.invalidInput("Ledger " + ledgerId + " has no pool");
        }
        if (!caller.carriesValue()) {
            throw CustodyRejectedException.invalidInput("Deposit must carry a positive value");
        }
        BigDecimal amount = caller.getAttachedValue();
        Instant now = clock.instant();

        CustodyRecord pool = recordStore.findForUpdate(ledgerId, POOL_KEY)
                .map(existing -> existing.credit(amount, now))
                .orElse(null);
        if (pool != null) {
            recordStore.update(pool);
        } else {
            pool = openPool(ledgerId, caller, amount, now);
        }
        disbursement.acceptDeposit(ledgerId, POOL_KEY, caller.getPrincipal(), amount);

        journal.record(ledgerId, POOL_KEY, EventKind.FUNDS_DEPOSITED, caller.getPrincipal(), null, amount, note);
        return pool;
    }

    /**
     * Owner or member sends part of the pool to a recipient. The pool is debited
     * before the transfer.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord withdraw(UUID ledgerId, CallerContext caller, String recipient,
                                  BigDecimal amount, String reason) {
        LedgerInstance ledger = accessControl.require(ledgerId, caller, Privilege.OWNER_OR_MEMBER);
        if (!ledger.getKind().accepts(RecordKind.TREASURY_POOL)) {
            throw CustodyRejectedException.invalidInput("Ledger " + ledgerId + " has no pool");
        }
        requirePositive(amount, "Withdrawal amount");
        if (recipient == null || recipient.isBlank()) {
            throw CustodyRejectedException.invalidInput("Recipient is required");
        }
        if (reason == null || reason.isBlank()) {
            throw CustodyRejectedException.invalidInput("Withdrawal reason is required");
        }
        CustodyRecord pool = recordStore.findForUpdate(ledgerId, POOL_KEY)
                .orElseThrow(() -> CustodyRejectedException.invalidState("Nothing has been deposited yet"));

        CustodyRecord debited = pool.debit(amount, clock.instant());
        disbursement.payout(debited, amount, recipient.trim());

        journal.record(ledgerId, POOL_KEY, EventKind.FUNDS_WITHDRAWN, caller.getPrincipal(),
                recipient.trim(), amount, reason.trim());
        return debited;
    }

    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public RecordView inspect(UUID ledgerId, String key) {
        accessControl.getLedger(ledgerId);
        CustodyRecord record = recordStore.find(ledgerId, key)
                .orElseThrow(() -> CustodyRejectedException.notFound("No record with key " + key));
        return RecordView.of(record, clock.instant());
    }

    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public List<RecordView> list(UUID ledgerId, RecordKind kind, String parentKey, int offset, int limit) {
        accessControl.getLedger(ledgerId);
        if (offset < 0) {
            throw CustodyRejectedException.invalidInput("Offset cannot be negative");
        }
        int size = pageSize(limit);
        Instant now = clock.instant();
        return recordStore.page(ledgerId, kind, parentKey, offset, size).stream()
                .map(record -> RecordView.of(record, now))
                .toList();
    }

    /**
     * Last {@code min(limit, size)} entries, most recent first. Never writes.
     */
    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public List<HistoryEntry> recentHistory(UUID ledgerId, int limit) {
        accessControl.getLedger(ledgerId);
        return historyLog.recent(ledgerId, pageSize(limit));
    }

    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public HistoryPage historyPage(UUID ledgerId, Long beforeSequence, int limit) {
        accessControl.getLedger(ledgerId);
        if (beforeSequence != null && beforeSequence <= 0) {
            throw CustodyRejectedException.invalidInput("Cursor must be positive");
        }
        return historyLog.page(ledgerId, beforeSequence, pageSize(limit));
    }

    private CustodyRecord redeem(CustodyRecord record, String recipient, CallerContext caller, String note) {
        if (!record.getKind().isMonetary() || record.getKind() == RecordKind.TREASURY_POOL) {
            throw CustodyRejectedException.invalidState(record.getKind() + " records cannot be redeemed");
        }
        BigDecimal amount = record.getValue();
        CustodyRecord redeemed = record.redeem(note, clock.instant());
        disbursement.payout(redeemed, amount, recipient);

        journal.record(record.getLedgerId(), record.getKey(), EventKind.RECORD_REDEEMED,
                caller.getPrincipal(), recipient, amount, note);
        return redeemed;
    }

    private CustodyRecord openPool(UUID ledgerId, CallerContext caller, BigDecimal amount, Instant now) {
        NewRecord request = NewRecord.builder()
                .key(POOL_KEY)
                .kind(RecordKind.TREASURY_POOL)
                .value(amount)
                .build();
        CustodyRecord pool = CustodyRecord.open(ledgerId, request, caller.getPrincipal(), now);
        if (!recordStore.insert(pool)) {
            // Lost the race to open the pool; credit the winner's row instead.
            pool = lockRecord(ledgerId, POOL_KEY).credit(amount, now);
            recordStore.update(pool);
        }
        log.info("Opened pool for ledger {}", ledgerId);
        return pool;
    }

    public CustodyRecord lockRecord(UUID ledgerId, String key) {
        if (key == null || key.isBlank()) {
            throw CustodyRejectedException.invalidInput("Record key is required");
        }
        return recordStore.findForUpdate(ledgerId, key)
                .orElseThrow(() -> CustodyRejectedException.notFound("No record with key " + key));
    }

    public void requireKeyFree(UUID ledgerId, String key) {
        if (recordStore.find(ledgerId, key).isPresent()) {
            throw CustodyRejectedException.alreadyExists("Key already used: " + key);
        }
    }

    public static void requireExactValue(CallerContext caller, BigDecimal expected) {
        if (expected == null || caller.getAttachedValue().compareTo(expected) != 0) {
            throw CustodyRejectedException.invalidInput(String.format(
                    "Attached value %s must equal %s exactly", caller.getAttachedValue(), expected));
        }
    }

    private int pageSize(int limit) {
        if (limit <= 0) {
            throw CustodyRejectedException.invalidInput("Limit must be positive");
        }
        return Math.min(limit, maxPageSize);
    }

    private void validateNewRecord(NewRecord request, CallerContext caller, Instant now) {
        RecordKind kind = request.getKind();
        String key = request.getKey();
        if (key == null || key.isBlank()) {
            throw CustodyRejectedException.invalidInput("Record key is required");
        }
        if (key.length() > MAX_KEY_LENGTH || key.indexOf('/') >= 0) {
            throw CustodyRejectedException.invalidInput("Record key must be at most 200 characters without '/'");
        }
        if (kind != RecordKind.GIFT_CARD && (request.getBeneficiary() == null || request.getBeneficiary().isBlank())) {
            throw CustodyRejectedException.invalidInput("Beneficiary is required");
        }
        if (request.getExpiresAt() != null && !request.getExpiresAt().isAfter(now)) {
            throw CustodyRejectedException.invalidInput("Expiry must be in the future");
        }

        if (kind.isMonetary()) {
            BigDecimal value = request.getValue();
            requirePositive(value, "Value");
            requireExactValue(caller, value);
        } else if (caller.carriesValue()) {
            throw CustodyRejectedException.invalidInput(kind + " records do not take value");
        }

        switch (kind) {
            case WARRANTY -> {
                if (request.getExpiresAt() == null) {
                    throw CustodyRejectedException.invalidInput("Warranty duration is required");
                }
            }
            case REGISTRY_ITEM -> requirePositive(request.getUnitAmount(), "Price");
            case EVENT -> {
                requirePositive(request.getUnitAmount(), "Deposit");
                if (request.getCapacity() == null || request.getCapacity() <= 0) {
                    throw CustodyRejectedException.invalidInput("Capacity must be positive");
                }
                if (request.getExpiresAt() == null) {
                    throw CustodyRejectedException.invalidInput("Event start is required");
                }
            }
            default -> {
            }
        }
    }

    private static void requirePositive(BigDecimal amount, String label) {
        if (amount == null || amount.signum() <= 0) {
            throw CustodyRejectedException.invalidInput(label + " must be positive");
        }
        CallerContext.requireStorableScale(amount, label);
    }
}
