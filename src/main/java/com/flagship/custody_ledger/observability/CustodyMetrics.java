package com.flagship.custody_ledger.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Metrics for custody operations.
 *
 * Metrics exposed:
 * - custody.operations: counter per operation and outcome (success or error code)
 * - custody.operation.duration: timer per operation
 * - custody.value.moved: summary of amounts per direction (in, out)
 * - custody.transfer.failures: counter of substrate failures per direction
 * - custody.reconciliation: counter of reconciliation checks per result
 */
@Component
public class CustodyMetrics {

    private final MeterRegistry registry;

    public CustodyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("custody.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        Timer.builder("custody.operation.duration")
                .description("Time taken by a custody operation")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordValueMoved(String direction, BigDecimal amount) {
        DistributionSummary.builder("custody.value.moved")
                .description("Value moved into or out of custody")
                .tag("direction", direction)
                .register(registry)
                .record(amount.doubleValue());
    }

    public void recordTransferFailure(String direction) {
        registry.counter("custody.transfer.failures", "direction", direction).increment();
    }

    public void recordReconciliation(boolean balanced) {
        registry.counter("custody.reconciliation", "result", balanced ? "balanced" : "mismatch").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
