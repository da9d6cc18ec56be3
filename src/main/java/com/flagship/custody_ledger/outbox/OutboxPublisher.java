package com.flagship.custody_ledger.outbox;

import com.flagship.custody_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes ledger events to Kafka, at least once.
 *
 * Events are keyed by ledger id, so one ledger's events land on one partition in
 * sequence order. Each send is awaited before the row is marked published. A
 * failed send bumps the retry count; once it reaches {@code outbox.publisher.max-retries}
 * the row is left as a dead letter for manual handling.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${custody.topic:custody-events}")
    private String custodyTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.publisher.retention-hours:168}")
    private long retentionHours;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    @Scheduled(cron = "${outbox.publisher.purge-cron:0 0 3 * * *}")
    public void purgePublishedEvents() {
        try {
            outboxService.purgePublishedOlderThan(Duration.ofHours(retentionHours));
        } catch (Exception e) {
            log.error("Error purging published outbox events", e);
        }
    }

    void publishEvent(OutboxEvent event) {
        String key = event.getLedgerId().toString();

        try {
            SendResult<String, String> result = kafkaTemplate.send(custodyTopic, key, event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            boolean deadLettered = outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (deadLettered) {
                log.warn("Event {} reached max retries ({}), left as dead letter. eventType={}, ledgerId={}",
                        event.getId(), outboxService.getMaxRetries(), event.getEventType(), event.getLedgerId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    public void triggerPublish() {
        publishPendingEvents();
    }
}
