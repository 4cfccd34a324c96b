package com.flagship.token_wallet.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for wallet movements, sessions and escrow.
 *
 * Metrics exposed:
 * - ledger.transfers: transfers by kind and outcome
 * - ledger.latency: time spent in ledger operations
 * - ledger.retries: optimistic conflicts that were retried
 * - idempotency.cache: replayed vs new transfer ids
 * - billing.sessions.*: session lifecycle and charged units/amount
 * - billing.escrow.*: escrow holds and resolutions
 * - event.processed / event.processing.failure: inbound usage events
 */
@Component
public class BillingMetrics {

    private final MeterRegistry registry;

    private final Counter sessionUnitsBilled;
    private final Counter sessionAmountBilled;

    public BillingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.sessionUnitsBilled = Counter.builder("billing.sessions.units_billed")
                .description("Billing units charged across all sessions")
                .register(registry);

        this.sessionAmountBilled = Counter.builder("billing.sessions.amount_billed")
                .description("Minor units charged to payers across all sessions")
                .baseUnit("tokens")
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordTransfer(String kind, String status) {
        registry.counter("ledger.transfers",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLedgerLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordRetry(String operation) {
        registry.counter("ledger.retries", "operation", sanitizeTag(operation)).increment();
    }

    /**
     * A transaction id that was already committed (replayed tick or request).
     */
    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // ==================== Sessions ====================

    public void recordSessionStarted(String sessionType) {
        registry.counter("billing.sessions.started", "type", sanitizeTag(sessionType)).increment();
    }

    public void recordSessionRejected(String sessionType, String reason) {
        registry.counter("billing.sessions.rejected",
                "type", sanitizeTag(sessionType),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordSessionCharged(String sessionType, long units, long amountMinor) {
        registry.counter("billing.sessions.charges", "type", sanitizeTag(sessionType)).increment();
        sessionUnitsBilled.increment(units);
        sessionAmountBilled.increment(amountMinor);
    }

    public void recordSessionEnded(String sessionType, String reason) {
        registry.counter("billing.sessions.ended",
                "type", sanitizeTag(sessionType),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void registerActiveSessionsGauge(Supplier<Number> supplier) {
        registry.gauge("billing.sessions.active", Tags.empty(), supplier, s -> s.get().doubleValue());
    }

    // ==================== Escrow ====================

    public void recordEscrowHeld(long grossMinor) {
        registry.counter("billing.escrow.held").increment();
        registry.counter("billing.escrow.held_amount").increment(grossMinor);
    }

    public void recordEscrowResolved(String status) {
        registry.counter("billing.escrow.resolved", "status", sanitizeTag(status)).increment();
    }

    // ==================== Event Processing ====================

    public void recordEventProcessed(String eventType, boolean wasNew) {
        registry.counter("event.processed",
                "event_type", sanitizeTag(eventType),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        registry.counter("event.processing.failure",
                "event_type", sanitizeTag(eventType),
                "error", sanitizeTag(error)
        ).increment();
    }

    /**
     * Keeps tag values short and free of special characters to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
