package com.flagship.custody_ledger.record;

import com.flagship.custody_ledger.error.CustodyRejectedException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The unit of custody.
 *
 * Explicit state machine, same rules for every ledger kind:
 * - ACTIVE/TRANSFERRED → TRANSFERRED (ownership change, stays active)
 * - ACTIVE/TRANSFERRED → VOIDED, REDEEMED, CANCELLED (terminal)
 * - EXPIRED is derived from {@code expiresAt} and never stored
 *
 * Instances are immutable. Every transition returns a new record with the version
 * bumped; the store refuses to write a record whose version is stale.
 *
 * Monetary transitions that release funds (redeem, cancel, check-in) zero the value
 * in the returned record. The caller must persist that record before moving any
 * funds.
 */
@Value
@Builder(toBuilder = true)
public class CustodyRecord {
    UUID ledgerId;
    String key;
    RecordKind kind;
    RecordStatus status;
    BigDecimal value;
    BigDecimal unitAmount;
    Integer capacity;
    int admitted;
    String beneficiary;
    String depositor;
    String parentKey;
    String payload;
    String closingNote;
    Instant createdAt;
    Instant expiresAt;
    Instant updatedAt;
    long version;

    /**
     * Creates a new record in ACTIVE status. Input validation is the caller's job;
     * this only fixes the initial state.
     */
    public static CustodyRecord open(UUID ledgerId, NewRecord request, String depositor, Instant now) {
        return CustodyRecord.builder()
                .ledgerId(ledgerId)
                .key(request.getKey())
                .kind(request.getKind())
                .status(RecordStatus.ACTIVE)
                .value(request.getValue() != null ? request.getValue() : BigDecimal.ZERO)
                .unitAmount(request.getUnitAmount())
                .capacity(request.getCapacity())
                .admitted(0)
                .beneficiary(request.getBeneficiary())
                .depositor(depositor)
                .parentKey(request.getParentKey())
                .payload(request.getPayload())
                .createdAt(now)
                .expiresAt(request.getExpiresAt())
                .updatedAt(now)
                .version(0)
                .build();
    }

    /**
     * Expiry is inclusive of the boundary: at {@code expiresAt} the record is expired,
     * one instant earlier it is not.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public RecordStatus effectiveStatus(Instant now) {
        if (status.isActiveState() && isExpiredAt(now)) {
            return RecordStatus.EXPIRED;
        }
        return status;
    }

    public boolean isValidAt(Instant now) {
        return effectiveStatus(now).isActiveState();
    }

    public boolean hasValue() {
        return value.signum() > 0;
    }

    public CustodyRecord transferTo(String newBeneficiary, Instant now) {
        requireUsable(now, "transfer");
        return next(now)
                .status(RecordStatus.TRANSFERRED)
                .beneficiary(newBeneficiary)
                .build();
    }

    /**
     * Voids the record. Allowed on an expired but unsettled record, so an owner can
     * still flag it. Value is left as it was; voiding never pays anybody.
     */
    public CustodyRecord voidRecord(String reason, Instant now) {
        requireActiveState("void");
        return next(now)
                .status(RecordStatus.VOIDED)
                .closingNote(reason)
                .build();
    }

    public CustodyRecord redeem(String note, Instant now) {
        requireUsable(now, "redeem");
        requireFunded("redeem");
        return next(now)
                .status(RecordStatus.REDEEMED)
                .value(BigDecimal.ZERO)
                .closingNote(note)
                .build();
    }

    /**
     * Depositor reclaims the funds. Expiry does not block this; it is how funds
     * left on an expired record get back to the depositor.
     */
    public CustodyRecord cancel(Instant now) {
        requireActiveState("cancel");
        requireFunded("cancel");
        return next(now)
                .status(RecordStatus.CANCELLED)
                .value(BigDecimal.ZERO)
                .build();
    }

    /**
     * Marks an RSVP as checked in and releases its deposit. Not bounded by time.
     */
    public CustodyRecord checkIn(Instant now) {
        if (status == RecordStatus.REDEEMED) {
            throw CustodyRejectedException.invalidState("Attendee " + beneficiary + " already checked in");
        }
        requireActiveState("check in");
        requireFunded("check in");
        return next(now)
                .status(RecordStatus.REDEEMED)
                .value(BigDecimal.ZERO)
                .build();
    }

    /**
     * Marks a registry item as bought by {@code purchaser}. The price passes straight
     * through to the registry owner, so the item never holds value itself.
     */
    public CustodyRecord purchase(String purchaser, Instant now) {
        requireUsable(now, "purchase");
        return next(now)
                .status(RecordStatus.REDEEMED)
                .beneficiary(purchaser)
                .build();
    }

    public CustodyRecord credit(BigDecimal amount, Instant now) {
        requireUsable(now, "credit");
        return next(now)
                .value(value.add(amount))
                .build();
    }

    public CustodyRecord debit(BigDecimal amount, Instant now) {
        requireUsable(now, "debit");
        if (amount.compareTo(value) > 0) {
            throw CustodyRejectedException.invalidState(
                    String.format("Cannot release %s from %s: only %s in custody", amount, key, value));
        }
        return next(now)
                .value(value.subtract(amount))
                .build();
    }

    /**
     * @throws CustodyRejectedException EXPIRED once the event has started, INVALID_STATE once voided
     */
    public void requireOpen(Instant now) {
        requireUsable(now, "admit to");
    }

    /**
     * Takes one seat of an event. Admission closes at {@code expiresAt}.
     */
    public CustodyRecord admit(Instant now) {
        requireOpen(now);
        if (capacity == null || admitted >= capacity) {
            throw CustodyRejectedException.capacityExceeded(
                    String.format("Event %s is full (%d of %d seats taken)", key, admitted, capacity));
        }
        return next(now)
                .admitted(admitted + 1)
                .build();
    }

    private CustodyRecordBuilder next(Instant now) {
        return toBuilder()
                .updatedAt(now)
                .version(version + 1);
    }

    private void requireActiveState(String action) {
        if (!status.isActiveState()) {
            throw CustodyRejectedException.invalidState(
                    String.format("Cannot %s %s in %s status", action, key, status));
        }
    }

    private void requireUsable(Instant now, String action) {
        requireActiveState(action);
        if (isExpiredAt(now)) {
            throw CustodyRejectedException.expired(
                    String.format("Cannot %s %s: expired at %s", action, key, expiresAt));
        }
    }

    private void requireFunded(String action) {
        if (!hasValue()) {
            throw CustodyRejectedException.invalidState(
                    String.format("Cannot %s %s: nothing in custody", action, key));
        }
    }
}
