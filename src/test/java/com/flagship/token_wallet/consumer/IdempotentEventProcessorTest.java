package com.flagship.token_wallet.consumer;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.common.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exactly-once application of inbound events per consumer group.
 */
@SpringBootTest
class IdempotentEventProcessorTest {

    private static final String GROUP = "test-group";
    private static final String AGGREGATE = "BillingSession";

    @Autowired
    private IdempotentEventProcessor processor;

    private UUID sessionId;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        sessionId = UUID.randomUUID();
        invocations = new AtomicInteger();
    }

    private IdempotentEventProcessor.Outcome process(UUID eventId, BillingResult<?> result) {
        return processor.processEvent(eventId, "UsageRecorded", AGGREGATE, sessionId, GROUP, () -> {
            invocations.incrementAndGet();
            return result;
        });
    }

    @Test
    @DisplayName("The same event is applied once; redeliveries are reported as duplicates")
    void duplicateSkipped() {
        UUID eventId = UUID.randomUUID();

        IdempotentEventProcessor.Outcome first = process(eventId, BillingResult.success("ok"));
        IdempotentEventProcessor.Outcome second = process(eventId, BillingResult.success("ok"));

        assertEquals(IdempotentEventProcessor.Outcome.PROCESSED, first);
        assertEquals(IdempotentEventProcessor.Outcome.DUPLICATE, second);
        assertEquals(1, invocations.get());
        assertTrue(processor.isAlreadyProcessed(eventId, GROUP));
    }

    @Test
    @DisplayName("A billing rejection is recorded as FAILED and not retried")
    void rejectionRecorded() {
        UUID eventId = UUID.randomUUID();

        IdempotentEventProcessor.Outcome first =
            process(eventId, BillingResult.failure(ErrorCode.SESSION_NOT_FOUND, "no such session"));
        IdempotentEventProcessor.Outcome second = process(eventId, BillingResult.success("ok"));

        assertEquals(IdempotentEventProcessor.Outcome.REJECTED, first);
        assertEquals(IdempotentEventProcessor.Outcome.DUPLICATE, second);
        assertEquals(1, invocations.get());

        List<ProcessedEvent> history = processor.getHistory(AGGREGATE, sessionId);
        assertEquals(1, history.size());
        assertEquals(ProcessedEvent.ProcessingResult.FAILED, history.get(0).getResult());
        assertTrue(history.get(0).getErrorMessage().contains("SESSION_NOT_FOUND"));
    }

    @Test
    @DisplayName("An exception rolls back the dedup record so the event can be redelivered")
    void exceptionNotRecorded() {
        UUID eventId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () ->
            processor.processEvent(eventId, "UsageRecorded", AGGREGATE, sessionId, GROUP, () -> {
                throw new IllegalStateException("database hiccup");
            }));

        assertFalse(processor.isAlreadyProcessed(eventId, GROUP));
        assertEquals(IdempotentEventProcessor.Outcome.PROCESSED, process(eventId, BillingResult.success("ok")));
    }

    @Test
    @DisplayName("Skipped events are remembered without running a handler")
    void skipEvent() {
        UUID eventId = UUID.randomUUID();

        processor.skipEvent(eventId, "SomethingElse", AGGREGATE, sessionId, GROUP, "Unknown event type");

        assertTrue(processor.isAlreadyProcessed(eventId, GROUP));
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, processor.getHistory(AGGREGATE, sessionId).get(0).getResult());
    }
}
