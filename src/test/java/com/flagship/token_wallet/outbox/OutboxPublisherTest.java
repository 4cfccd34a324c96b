package com.flagship.token_wallet.outbox;

import com.flagship.token_wallet.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher routing and failure bookkeeping, with Kafka and the outbox table mocked.
 */
class OutboxPublisherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private OutboxService outboxService;
    private KafkaTemplate<String, String> kafkaTemplate;
    private OutboxMetrics outboxMetrics;
    private OutboxPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        outboxService = mock(OutboxService.class);
        kafkaTemplate = mock(KafkaTemplate.class);
        outboxMetrics = mock(OutboxMetrics.class);
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(publisher, "sessionsTopic", "billing.sessions");
        ReflectionTestUtils.setField(publisher, "bookingsTopic", "billing.bookings");
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 5);
        ReflectionTestUtils.setField(publisher, "retention", Duration.ofDays(7));
    }

    private static OutboxEvent event(String aggregateType, String eventType, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, UUID.randomUUID(), eventType,
            "{\"eventType\":\"" + eventType + "\"}", NOW, null, retryCount, null);
    }

    private static CompletableFuture<SendResult<String, String>> acked(String topic, String key, String value) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(topic, 0), 0L, 0, NOW.toEpochMilli(), 36, 20);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(topic, key, value), metadata));
    }

    @Test
    @DisplayName("Session events go to the sessions topic keyed by session id")
    void sessionEventRouting() {
        OutboxEvent charged = event(OutboxPublisher.SESSION_AGGREGATE, "SessionCharged", 0);
        String key = charged.getAggregateId().toString();
        when(outboxService.findPublishable(5, 100)).thenReturn(List.of(charged));
        when(kafkaTemplate.send("billing.sessions", key, charged.getPayload()))
            .thenReturn(acked("billing.sessions", key, charged.getPayload()));

        publisher.publishPendingEvents();

        verify(kafkaTemplate).send("billing.sessions", key, charged.getPayload());
        verify(outboxService).markPublished(charged.getId());
        verify(outboxMetrics).recordEventPublished("SessionCharged");
    }

    @Test
    @DisplayName("Escrow events go to the bookings topic")
    void escrowEventRouting() {
        OutboxEvent held = event(OutboxPublisher.ESCROW_AGGREGATE, "EscrowHeld", 0);

        assertEquals("billing.bookings", publisher.topicFor(held));
        assertEquals("billing.sessions", publisher.topicFor(event(OutboxPublisher.SESSION_AGGREGATE, "SessionEnded", 0)));
    }

    @Test
    @DisplayName("A failed send is marked failed and the event stays pending")
    void sendFailure() {
        OutboxEvent ended = event(OutboxPublisher.SESSION_AGGREGATE, "SessionEnded", 0);
        when(outboxService.findPublishable(5, 100)).thenReturn(List.of(ended));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(ended.getId()), any());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("SessionEnded");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
    }

    @Test
    @DisplayName("The last allowed failure turns the event into a dead letter")
    void deadLetter() {
        OutboxEvent ended = event(OutboxPublisher.SESSION_AGGREGATE, "SessionEnded", 4);
        when(outboxService.findPublishable(5, 100)).thenReturn(List.of(ended));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.publishPendingEvents();

        verify(outboxMetrics).recordEventDeadLettered("SessionEnded");
    }

    @Test
    @DisplayName("An event with no topic is marked failed without blocking the rest of the batch")
    void unroutableEvent() {
        OutboxEvent stray = event("Payment", "PaymentCreated", 0);
        OutboxEvent held = event(OutboxPublisher.ESCROW_AGGREGATE, "EscrowHeld", 0);
        String key = held.getAggregateId().toString();
        when(outboxService.findPublishable(anyInt(), anyInt())).thenReturn(List.of(stray, held));
        when(kafkaTemplate.send("billing.bookings", key, held.getPayload()))
            .thenReturn(acked("billing.bookings", key, held.getPayload()));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(stray.getId()), any());
        verify(outboxService).markPublished(held.getId());
    }

    @Test
    @DisplayName("Purging removes published events older than the retention")
    void purge() {
        publisher.purgePublishedEvents();

        verify(outboxService).purgePublishedBefore(NOW.minus(Duration.ofDays(7)));
    }
}
