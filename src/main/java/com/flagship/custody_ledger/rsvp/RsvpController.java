package com.flagship.custody_ledger.rsvp;

import com.flagship.custody_ledger.identity.CallerContext;
import com.flagship.custody_ledger.record.RecordView;
import com.flagship.custody_ledger.record.dto.VoidRecordRequest;
import com.flagship.custody_ledger.rsvp.dto.CheckInRequest;
import com.flagship.custody_ledger.rsvp.dto.CreateEventRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/ledgers/{ledgerId}/events")
@RequiredArgsConstructor
public class RsvpController {

    private final RsvpService rsvpService;

    @PostMapping
    public ResponseEntity<RecordView> createEvent(
            @PathVariable("ledgerId") UUID ledgerId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody CreateEventRequest request) {
        RecordView view = rsvpService.createEvent(ledgerId, CallerContext.of(callerId), request.getEventId(),
                request.getName(), request.getDeposit(), request.getCapacity(), request.getStartsAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<RecordView> inspect(@PathVariable("ledgerId") UUID ledgerId,
                                              @PathVariable("eventId") String eventId) {
        return ResponseEntity.ok(rsvpService.inspectEvent(ledgerId, eventId));
    }

    @PostMapping("/{eventId}/rsvp")
    public ResponseEntity<RecordView> rsvp(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("eventId") String eventId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @RequestHeader(value = CallerContext.ATTACHED_VALUE_HEADER, required = false) BigDecimal attachedValue) {
        RecordView view = rsvpService.rsvp(ledgerId, CallerContext.of(callerId, attachedValue), eventId);
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @PostMapping("/{eventId}/check-ins")
    public ResponseEntity<RecordView> checkIn(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("eventId") String eventId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody CheckInRequest request) {
        return ResponseEntity.ok(rsvpService.checkIn(ledgerId, CallerContext.of(callerId), eventId,
                request.getAttendee()));
    }

    @PostMapping("/{eventId}/rsvp/withdraw")
    public ResponseEntity<RecordView> withdraw(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("eventId") String eventId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId) {
        return ResponseEntity.ok(rsvpService.withdraw(ledgerId, CallerContext.of(callerId), eventId));
    }

    @PostMapping("/{eventId}/void")
    public ResponseEntity<RecordView> cancelEvent(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("eventId") String eventId,
            @RequestHeader(CallerContext.CALLER_HEADER) String callerId,
            @Valid @RequestBody VoidRecordRequest request) {
        return ResponseEntity.ok(rsvpService.cancelEvent(ledgerId, CallerContext.of(callerId), eventId,
                request.getReason()));
    }

    @GetMapping("/{eventId}/attendees")
    public ResponseEntity<List<RecordView>> attendees(
            @PathVariable("ledgerId") UUID ledgerId,
            @PathVariable("eventId") String eventId,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(rsvpService.attendees(ledgerId, eventId, offset, limit));
    }
}
