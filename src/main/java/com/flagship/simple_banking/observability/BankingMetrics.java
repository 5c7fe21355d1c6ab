package com.flagship.simple_banking.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the banking API.
 *
 * Metrics exposed:
 * - accounts.created: accounts created, tagged by outcome
 * - transactions.created: transactions created, tagged by operation type and outcome
 * - transactions.latency: time spent creating a transaction
 * - idempotency.cache: idempotency lookups, tagged hit / miss / wait / eviction
 */
@Component
public class BankingMetrics {

    private final MeterRegistry registry;

    public BankingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAccountCreated(String status) {
        registry.counter("accounts.created", "status", sanitizeTag(status)).increment();
    }

    public void recordTransactionCreated(String operationType, String status) {
        registry.counter("transactions.created",
                "operation_type", sanitizeTag(operationType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordTransactionLatency(long durationMs) {
        registry.timer("transactions.latency").record(Duration.ofMillis(durationMs));
    }

    /**
     * Records a replay of a completed response.
     */
    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    /**
     * Records a fresh claim of a key (handler will run).
     */
    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Records a caller that had to block on an in-flight key.
     */
    public void recordIdempotencyWait() {
        registry.counter("idempotency.cache", "result", "wait").increment();
    }

    public void recordIdempotencyEvictions(int count) {
        registry.counter("idempotency.cache", "result", "eviction").increment(count);
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
