package com.flagship.custody_ledger.record;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Read-only projection of a record as of a given instant.
 */
@Value
@Builder
public class RecordView {

    @JsonProperty("key")
    String key;

    @JsonProperty("kind")
    RecordKind kind;

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("status")
    RecordStatus status;

    @JsonProperty("beneficiary")
    String beneficiary;

    @JsonProperty("depositor")
    String depositor;

    @JsonProperty("value")
    BigDecimal value;

    @JsonProperty("unit_amount")
    BigDecimal unitAmount;

    @JsonProperty("capacity")
    Integer capacity;

    @JsonProperty("admitted")
    int admitted;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("payload")
    String payload;

    @JsonProperty("closing_note")
    String closingNote;

    public static RecordView of(CustodyRecord record, Instant now) {
        RecordStatus effective = record.effectiveStatus(now);
        return RecordView.builder()
                .key(record.getKey())
                .kind(record.getKind())
                .valid(effective.isActiveState())
                .status(effective)
                .beneficiary(record.getBeneficiary())
                .depositor(record.getDepositor())
                .value(record.getValue())
                .unitAmount(record.getUnitAmount())
                .capacity(record.getCapacity())
                .admitted(record.getAdmitted())
                .createdAt(record.getCreatedAt())
                .expiresAt(record.getExpiresAt())
                .payload(record.getPayload())
                .closingNote(record.getClosingNote())
                .build();
    }
}
