package com.flagship.custody_ledger.observability;

import com.flagship.custody_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox health as Micrometer gauges: backlog size, age of the oldest pending
 * event and dead-lettered events. Gauges read cached values refreshed by
 * {@link MetricsScheduler}, not the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("custody.events.pending", backlogSize, AtomicLong::get)
                .description("Committed ledger events not yet acknowledged by Kafka")
                .register(meterRegistry);

        Gauge.builder("custody.events.pending.oldest.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Seconds since the oldest pending ledger event was committed")
                .register(meterRegistry);

        Gauge.builder("custody.events.dead_lettered", deadLetteredCount, AtomicLong::get)
                .description("Ledger events the publisher has given up on")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());

            oldestEventAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, clock.instant()).getSeconds()))
                    .orElse(0L));

            deadLetteredCount.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));

            log.debug("Ledger event gauges: pending={}, oldest={}s, deadLettered={}",
                    backlogSize.get(), oldestEventAgeSeconds.get(), deadLetteredCount.get());

        } catch (DataAccessException e) {
            log.warn("Could not refresh ledger event gauges: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventKind) {
        publishAttempt(eventKind, "published");
    }

    public void recordEventPublishFailed(String eventKind) {
        publishAttempt(eventKind, "retry");
    }

    public void recordEventDeadLettered(String eventKind) {
        publishAttempt(eventKind, "dead_lettered");
    }

    private void publishAttempt(String eventKind, String outcome) {
        meterRegistry.counter("custody.events.publish", "event_kind", eventKind, "outcome", outcome).increment();
    }
}
