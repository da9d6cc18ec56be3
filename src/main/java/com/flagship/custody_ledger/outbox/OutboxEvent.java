package com.flagship.custody_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox table for the publisher.
 *
 * Written in the same transaction as the transition that produced it, so an
 * outbox row exists if and only if that transition committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    UUID ledgerId;
    String recordKey;
    String eventType;          // EventKind name
    String payload;            // serialized LedgerEvent
    Instant createdAt;
    Instant publishedAt;       // null until Kafka acknowledged
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(UUID id, UUID ledgerId, String recordKey,
                                     String eventType, String payload, Instant now) {
        return new OutboxEvent(id, ledgerId, recordKey, eventType, payload, now, null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
