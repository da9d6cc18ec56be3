package com.flagship.custody_ledger.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Observer-facing notification of a committed transition.
 *
 * Serialized as the outbox payload and published keyed by ledger id, so consumers
 * see the events of one ledger in commit order.
 */
@Value
@Builder
public class LedgerEvent {

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("event_kind")
    EventKind eventKind;

    @JsonProperty("ledger_id")
    UUID ledgerId;

    @JsonProperty("record_key")
    String recordKey;

    @JsonProperty("principals")
    List<String> principals;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("occurred_at")
    Instant occurredAt;
}
