package com.flagship.token_wallet.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A billing event waiting in the outbox table to be published to Kafka.
 *
 * Written in the same transaction as the ledger movement or session change
 * it describes, so a committed charge always has its event and a rolled back
 * one never does.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "BillingSession" or "Escrow"
    UUID aggregateId;
    String eventType;          // e.g. "SessionCharged"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;

    /**
     * New unpublished event. The event id is reused as the outbox row id so
     * consumers can deduplicate on it.
     */
    public static OutboxEvent create(UUID eventId, String aggregateType, UUID aggregateId,
                                     String eventType, String payload, Instant createdAt) {
        return new OutboxEvent(eventId, aggregateType, aggregateId, eventType, payload,
            createdAt, null, 0, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return publishedAt == null && retryCount >= maxRetries;
    }
}
