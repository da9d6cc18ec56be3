package com.flagship.custody_ledger.outbox;

import com.flagship.custody_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour against a mocked broker: keying, acknowledgement and retry bookkeeping.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "custody-events";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics);
        ReflectionTestUtils.setField(publisher, "custodyTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 10);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
    }

    private static OutboxEvent pending(UUID ledgerId, String type) {
        return OutboxEvent.create(UUID.randomUUID(), ledgerId, "K1", type,
                "{\"event_kind\":\"" + type + "\"}", Instant.parse("2024-03-01T12:00:00Z"));
    }

    private static SendResult<String, String> acknowledged(String key, String payload) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 1), 42L, 0, 0L, 0, 0);
        return new SendResult<>(new ProducerRecord<>(TOPIC, key, payload), metadata);
    }

    @Test
    @DisplayName("Acknowledged send marks the event published, keyed by ledger id")
    void publishesKeyedByLedger() {
        UUID ledgerId = UUID.randomUUID();
        OutboxEvent event = pending(ledgerId, "RECORD_CREATED");
        when(outboxService.findPublishableEvents(10)).thenReturn(List.of(event));
        when(kafkaTemplate.send(TOPIC, ledgerId.toString(), event.getPayload()))
                .thenReturn(CompletableFuture.completedFuture(acknowledged(ledgerId.toString(), event.getPayload())));

        publisher.triggerPublish();

        verify(outboxService).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublished("RECORD_CREATED");
        verify(outboxService, never()).markFailed(eq(event.getId()), anyString());
    }

    @Test
    @DisplayName("Broker failure bumps the retry count and stays unpublished")
    void failureIsRetried() {
        UUID ledgerId = UUID.randomUUID();
        OutboxEvent event = pending(ledgerId, "RECORD_REDEEMED");
        when(kafkaTemplate.send(TOPIC, ledgerId.toString(), event.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        when(outboxService.markFailed(eq(event.getId()), anyString())).thenReturn(false);

        publisher.publishEvent(event);

        verify(outboxService, never()).markPublished(event.getId());
        verify(outboxMetrics).recordEventPublishFailed("RECORD_REDEEMED");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("Last allowed failure leaves the event as a dead letter")
    void deadLetter() {
        UUID ledgerId = UUID.randomUUID();
        OutboxEvent event = pending(ledgerId, "FUNDS_WITHDRAWN");
        when(kafkaTemplate.send(TOPIC, ledgerId.toString(), event.getPayload()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        when(outboxService.markFailed(eq(event.getId()), anyString())).thenReturn(true);
        when(outboxService.getMaxRetries()).thenReturn(5);

        publisher.publishEvent(event);

        verify(outboxMetrics).recordEventDeadLettered("FUNDS_WITHDRAWN");
    }

    @Test
    @DisplayName("Empty outbox sends nothing")
    void emptyOutbox() {
        when(outboxService.findPublishableEvents(anyInt())).thenReturn(List.of());

        publisher.publishPendingEvents();

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }
}
