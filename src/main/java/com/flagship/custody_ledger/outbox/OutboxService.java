package com.flagship.custody_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Writes events into the outbox inside the caller's transaction and serves the
 * publisher's bookkeeping in transactions of its own.
 *
 * If the caller's transaction rolls back, the event goes with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    /**
     * Must run inside an existing transaction; MANDATORY refuses to open one.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(UUID eventId, UUID ledgerId, String recordKey,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(eventId, ledgerId, recordKey, eventType,
                serializePayload(payload), clock.instant());

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, ledgerId={}, recordKey={}", eventType, ledgerId, recordKey);

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * @return true if this failure moved the event to dead letter
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount() >= maxRetries;
        }).orElse(false);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForLedger(UUID ledgerId) {
        return repository.findByLedgerIdOrderBySequenceNumberAsc(ledgerId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional(readOnly = true)
    public long countDeadLettered() {
        return repository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
    }

    @Transactional
    public int purgePublishedOlderThan(Duration retention) {
        int deleted = repository.deletePublishedEventsBefore(clock.instant().minus(retention));
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {}", deleted, retention);
        }
        return deleted;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
