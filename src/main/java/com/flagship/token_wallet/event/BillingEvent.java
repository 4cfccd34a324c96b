package com.flagship.token_wallet.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for billing facts published through the outbox.
 *
 * All billing events share:
 * - Event ID for deduplication in consumers
 * - Aggregate ID (session or escrow) used as the Kafka key
 * - Timestamp of when the fact happened
 */
public interface BillingEvent {

    UUID getEventId();

    UUID getAggregateId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
