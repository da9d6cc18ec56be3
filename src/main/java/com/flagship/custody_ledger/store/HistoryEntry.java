package com.flagship.custody_ledger.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.custody_ledger.event.EventKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One line of a ledger's audit trail. Never edited once appended.
 *
 * {@code sequence} is assigned by the log on append and is strictly increasing
 * in insertion order.
 */
@Value
@Builder(toBuilder = true)
public class HistoryEntry {

    @JsonProperty("sequence")
    Long sequence;

    @JsonProperty("ledger_id")
    UUID ledgerId;

    @JsonProperty("record_key")
    String recordKey;

    @JsonProperty("action")
    EventKind action;

    @JsonProperty("actor")
    String actor;

    @JsonProperty("counterparty")
    String counterparty;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("occurred_at")
    Instant occurredAt;
}
