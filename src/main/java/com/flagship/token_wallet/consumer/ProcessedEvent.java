package com.flagship.token_wallet.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of an inbound event this service has already handled, so that Kafka
 * redeliveries and replays never meter the same usage twice.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,    // applied to the session
        SKIPPED,    // not relevant to this consumer
        FAILED      // rejected by billing (unknown session, frozen wallet...), not retried
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant processedAt) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            processedAt, ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, Instant processedAt,
                                         String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            processedAt, ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType, String aggregateType,
                                        UUID aggregateId, String consumerGroup, Instant processedAt,
                                        String errorMessage) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            processedAt, ProcessingResult.FAILED, errorMessage);
    }
}
