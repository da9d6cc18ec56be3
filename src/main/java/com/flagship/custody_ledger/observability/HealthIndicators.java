package com.flagship.custody_ledger.observability;

import com.flagship.custody_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the ledger event pipeline.
 */
public class HealthIndicators {

    /**
     * Ledger events that have not reached Kafka.
     *
     * A growing backlog is a warning. Any dead-lettered event takes the pipeline
     * out of service because observers have permanently missed a transition.
     */
    @Component("ledgerEventsHealth")
    @RequiredArgsConstructor
    public static class LedgerEventsHealthIndicator implements HealthIndicator {

        static final long BACKLOG_WARNING = 1_000;
        static final long BACKLOG_DOWN = 10_000;

        private final OutboxService outboxService;

        @Override
        public Health health() {
            long backlog;
            long deadLettered;
            try {
                backlog = outboxService.countUnpublished();
                deadLettered = outboxService.countDeadLettered();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }

            Status status;
            if (backlog >= BACKLOG_DOWN) {
                status = Status.DOWN;
            } else if (deadLettered > 0) {
                status = Status.OUT_OF_SERVICE;
            } else if (backlog >= BACKLOG_WARNING) {
                status = new Status("WARNING");
            } else {
                status = Status.UP;
            }

            return Health.status(status)
                    .withDetail("backlog", backlog)
                    .withDetail("deadLettered", deadLettered)
                    .withDetail("maxRetries", outboxService.getMaxRetries())
                    .build();
        }
    }

    /**
     * Whether the producer behind the outbox publisher has opened any connection.
     */
    @Component("ledgerEventsProducerHealth")
    @RequiredArgsConstructor
    public static class ProducerHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        @Override
        public Health health() {
            try {
                int producerMetrics = kafkaTemplate.metrics().size();
                Health.Builder builder = producerMetrics == 0 ? Health.unknown() : Health.up();
                return builder.withDetail("producerMetrics", producerMetrics).build();
            } catch (RuntimeException e) {
                return Health.down(e).build();
            }
        }
    }
}
