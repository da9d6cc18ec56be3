package com.flagship.custody_ledger.record;

import com.flagship.custody_ledger.access.AccessControlService;
import com.flagship.custody_ledger.access.LedgerInstance;
import com.flagship.custody_ledger.disbursement.DisbursementService;
import com.flagship.custody_ledger.error.CustodyRejectedException;
import com.flagship.custody_ledger.event.EventKind;
import com.flagship.custody_ledger.event.TransitionJournal;
import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Time- and capacity-bounded admission to events.
 *
 * An RSVP is its own monetary record keyed {@code <eventKey>/<attendee>} holding the
 * attendee's deposit. The event row is locked while a seat is taken, so concurrent
 * RSVPs for one event are admitted one at a time and never overshoot capacity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdmissionControl {

    private final AccessControlService accessControl;
    private final CustodyEngine engine;
    private final RecordStore recordStore;
    private final DisbursementService disbursement;
    private final TransitionJournal journal;
    private final Clock clock;

    public static String rsvpKey(String eventKey, String attendee) {
        return eventKey + "/" + attendee;
    }

    /**
     * Reserves a seat for the caller. The event must not have started, the attached
     * value must equal the event's deposit exactly, and the caller must not hold a seat.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord rsvp(UUID ledgerId, CallerContext caller, String eventKey) {
        accessControl.getLedger(ledgerId);
        CustodyRecord event = lockEvent(ledgerId, eventKey);
        Instant now = clock.instant();
        event.requireOpen(now);
        CustodyEngine.requireExactValue(caller, event.getUnitAmount());

        String key = rsvpKey(eventKey, caller.getPrincipal());
        engine.requireKeyFree(ledgerId, key);

        CustodyRecord admitted = event.admit(now);
        recordStore.update(admitted);

        NewRecord request = NewRecord.builder()
                .key(key)
                .kind(RecordKind.RSVP)
                .beneficiary(caller.getPrincipal())
                .value(event.getUnitAmount())
                .parentKey(eventKey)
                .build();
        CustodyRecord rsvp = CustodyRecord.open(ledgerId, request, caller.getPrincipal(), now);
        if (!recordStore.insert(rsvp)) {
            throw new IllegalStateException("RSVP key taken while holding the event lock: " + key);
        }
        disbursement.acceptDeposit(ledgerId, key, caller.getPrincipal(), rsvp.getValue());

        journal.record(ledgerId, key, EventKind.RECORD_CREATED, caller.getPrincipal(),
                null, rsvp.getValue(), null);
        log.info("Admitted {} to {} ({} of {} seats)", caller.getPrincipal(), eventKey,
                admitted.getAdmitted(), admitted.getCapacity());
        return rsvp;
    }

    /**
     * Organizer checks an attendee in, refunding the deposit once. Works at any
     * time, including after the event started.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord checkIn(UUID ledgerId, CallerContext caller, String eventKey, String attendee) {
        accessControl.requireOwner(ledgerId, caller);
        findEvent(ledgerId, eventKey);
        if (attendee == null || attendee.isBlank()) {
            throw CustodyRejectedException.invalidInput("Attendee is required");
        }
        String key = rsvpKey(eventKey, attendee.trim());
        CustodyRecord rsvp = recordStore.findForUpdate(ledgerId, key)
                .orElseThrow(() -> CustodyRejectedException.invalidState(attendee + " has not RSVP'd to " + eventKey));

        BigDecimal deposit = rsvp.getValue();
        CustodyRecord checkedIn = rsvp.checkIn(clock.instant());
        disbursement.payout(checkedIn, deposit, rsvp.getBeneficiary());

        journal.record(ledgerId, key, EventKind.RECORD_REDEEMED, caller.getPrincipal(),
                rsvp.getBeneficiary(), deposit, "checked in");
        return checkedIn;
    }

    /**
     * Attendee takes the deposit back after the organizer voided the event.
     */
    @Transactional(noRollbackFor = CustodyRejectedException.class)
    public CustodyRecord withdrawRsvp(UUID ledgerId, CallerContext caller, String eventKey) {
        accessControl.getLedger(ledgerId);
        CustodyRecord event = findEvent(ledgerId, eventKey);
        String key = rsvpKey(eventKey, caller.getPrincipal());
        CustodyRecord rsvp = recordStore.findForUpdate(ledgerId, key)
                .orElseThrow(() -> CustodyRejectedException.notFound(caller.getPrincipal() + " has no RSVP for " + eventKey));
        if (event.getStatus() != RecordStatus.VOIDED) {
            throw CustodyRejectedException.invalidState("Deposits are only returned for voided events");
        }

        BigDecimal deposit = rsvp.getValue();
        CustodyRecord cancelled = rsvp.cancel(clock.instant());
        disbursement.payout(cancelled, deposit, rsvp.getDepositor());

        journal.record(ledgerId, key, EventKind.RECORD_CANCELLED, caller.getPrincipal(),
                null, deposit, "event voided");
        return cancelled;
    }

    @Transactional(readOnly = true, noRollbackFor = CustodyRejectedException.class)
    public List<RecordView> attendees(UUID ledgerId, String eventKey, int offset, int limit) {
        LedgerInstance ledger = accessControl.getLedger(ledgerId);
        findEvent(ledger.getId(), eventKey);
        return engine.list(ledgerId, RecordKind.RSVP, eventKey, offset, limit);
    }

    private CustodyRecord lockEvent(UUID ledgerId, String eventKey) {
        CustodyRecord event = engine.lockRecord(ledgerId, eventKey);
        if (event.getKind() != RecordKind.EVENT) {
            throw CustodyRejectedException.invalidInput(eventKey + " is not an event");
        }
        return event;
    }

    private CustodyRecord findEvent(UUID ledgerId, String eventKey) {
        if (eventKey == null || eventKey.isBlank()) {
            throw CustodyRejectedException.invalidInput("Event key is required");
        }
        CustodyRecord event = recordStore.find(ledgerId, eventKey)
                .orElseThrow(() -> CustodyRejectedException.notFound("No event with key " + eventKey));
        if (event.getKind() != RecordKind.EVENT) {
            throw CustodyRejectedException.invalidInput(eventKey + " is not an event");
        }
        return event;
    }
}
