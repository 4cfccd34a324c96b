package com.flagship.token_wallet.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.observability.CorrelationContext;
import com.flagship.token_wallet.session.BillingOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Consumes chat and call usage from the usage topic and meters it.
 *
 * Offsets are acknowledged manually after the event and its dedup record have
 * committed. Records that throw are not acknowledged and will be redelivered;
 * unparseable records are acknowledged and dropped.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class UsageEventConsumer {

    static final String CONSUMER_GROUP = "billing-usage-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final UsageEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.usage:billing.usage}",
        groupId = "${spring.kafka.consumer.group-id:token-wallet-billing}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        CorrelationContext.begin(headerValue(record, CorrelationContext.CORRELATION_ID_HEADER));
        try {
            log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

            EventEnvelope envelope = parseEnvelope(record.value());
            if (envelope == null) {
                log.warn("Could not parse usage event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            IdempotentEventProcessor.Outcome outcome = route(envelope, record.value());
            ack.acknowledge();

            log.debug("Usage event {} ({}) for session {}: {}",
                envelope.eventId(), envelope.eventType(), envelope.sessionId(), outcome);
        } catch (RuntimeException e) {
            log.error("Error processing usage event at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.clear();
        }
    }

    IdempotentEventProcessor.Outcome route(EventEnvelope envelope, String rawPayload) {
        return switch (envelope.eventType()) {
            case MessageSentEvent.EVENT_TYPE -> process(envelope,
                () -> eventHandler.onMessageSent(deserialize(rawPayload, MessageSentEvent.class)));
            case CallHeartbeatEvent.EVENT_TYPE -> process(envelope,
                () -> eventHandler.onCallHeartbeat(deserialize(rawPayload, CallHeartbeatEvent.class)));
            case UsageRecordedEvent.EVENT_TYPE -> process(envelope,
                () -> eventHandler.onUsageRecorded(deserialize(rawPayload, UsageRecordedEvent.class)));
            case SessionClosedEvent.EVENT_TYPE -> process(envelope,
                () -> eventHandler.onSessionClosed(deserialize(rawPayload, SessionClosedEvent.class)));
            default -> {
                log.debug("Unknown event type: {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(),
                    BillingOrchestrator.AGGREGATE_TYPE, envelope.sessionId(),
                    CONSUMER_GROUP, "Unknown event type");
                yield IdempotentEventProcessor.Outcome.REJECTED;
            }
        };
    }

    private IdempotentEventProcessor.Outcome process(EventEnvelope envelope, Supplier<BillingResult<?>> handler) {
        return eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
            BillingOrchestrator.AGGREGATE_TYPE, envelope.sessionId(), CONSUMER_GROUP, handler);
    }

    EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("sessionId")
                    || !node.hasNonNull("eventType")) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(node.get("sessionId").asText()),
                node.get("eventType").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    record EventEnvelope(UUID eventId, UUID sessionId, String eventType) {}
}
