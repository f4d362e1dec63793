package com.flagship.escrow_engine.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for escrow operations.
 *
 * Metrics exposed:
 * - escrow.transitions{operation, outcome}: every create/fund/accept/complete/dispute/refund,
 *   outcome "success" or the lower-cased error code
 * - escrow.latency{operation}: operation duration
 * - escrow.custody.moved{direction}: amounts moved into ("in") and out of ("out") custody
 * - idempotency.cache{result}: hit/miss of the create idempotency lookup
 */
@Component
public class EscrowMetrics {

    private final MeterRegistry registry;

    public EscrowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String operation, String outcome) {
        registry.counter("escrow.transitions",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("escrow.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordCustodyIn(long amount) {
        registry.counter("escrow.custody.moved", "direction", "in").increment(amount);
    }

    public void recordCustodyOut(long amount) {
        registry.counter("escrow.custody.moved", "direction", "out").increment(amount);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
