package com.flagship.custody_ledger.rsvp;

import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.observability.OperationObserver;
import com.flagship.custody_ledger.record.AdmissionControl;
import com.flagship.custody_ledger.record.CustodyEngine;
import com.flagship.custody_ledger.record.NewRecord;
import com.flagship.custody_ledger.record.RecordKind;
import com.flagship.custody_ledger.record.RecordView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Event RSVP escrow. Attendees lock a deposit to hold a seat and get it back
 * when the organizer checks them in. Seats close when the event starts.
 */
@Service
@RequiredArgsConstructor
public class RsvpService {

    private final CustodyEngine engine;
    private final AdmissionControl admission;
    private final OperationObserver observer;
    private final Clock clock;

    public RecordView createEvent(UUID ledgerId, CallerContext caller, String eventId, String name,
                                  BigDecimal deposit, Integer capacity, Instant startsAt) {
        return observer.observe("rsvp.create_event", ledgerId, eventId, () -> {
            NewRecord request = NewRecord.builder()
                    .key(eventId)
                    .kind(RecordKind.EVENT)
                    .beneficiary(caller.getPrincipal())
                    .unitAmount(deposit)
                    .capacity(capacity)
                    .payload(name)
                    .expiresAt(startsAt)
                    .build();
            return RecordView.of(engine.create(ledgerId, caller, request), clock.instant());
        });
    }

    public RecordView inspectEvent(UUID ledgerId, String eventId) {
        return engine.inspect(ledgerId, eventId);
    }

    public RecordView rsvp(UUID ledgerId, CallerContext caller, String eventId) {
        return observer.observe("rsvp.reserve", ledgerId, eventId,
                () -> RecordView.of(admission.rsvp(ledgerId, caller, eventId), clock.instant()));
    }

    public RecordView checkIn(UUID ledgerId, CallerContext caller, String eventId, String attendee) {
        return observer.observe("rsvp.check_in", ledgerId, eventId,
                () -> RecordView.of(admission.checkIn(ledgerId, caller, eventId, attendee), clock.instant()));
    }

    public RecordView withdraw(UUID ledgerId, CallerContext caller, String eventId) {
        return observer.observe("rsvp.withdraw", ledgerId, eventId,
                () -> RecordView.of(admission.withdrawRsvp(ledgerId, caller, eventId), clock.instant()));
    }

    public RecordView cancelEvent(UUID ledgerId, CallerContext caller, String eventId, String reason) {
        return observer.observe("rsvp.void_event", ledgerId, eventId,
                () -> RecordView.of(engine.voidRecord(ledgerId, caller, eventId, reason), clock.instant()));
    }

    public List<RecordView> attendees(UUID ledgerId, String eventId, int offset, int limit) {
        return admission.attendees(ledgerId, eventId, offset, limit);
    }
}
