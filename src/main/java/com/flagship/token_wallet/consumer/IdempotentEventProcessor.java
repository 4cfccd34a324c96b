package com.flagship.token_wallet.consumer;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.observability.BillingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Applies each inbound event at most once per consumer group.
 *
 * The handler runs in the same transaction as the processed_events insert, so a
 * metered usage event and its dedup record commit together. Typed billing failures
 * are recorded as FAILED and committed: redelivering them would fail the same way.
 * Exceptions roll everything back and leave the record for Kafka to redeliver.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    public enum Outcome { PROCESSED, REJECTED, DUPLICATE }

    private final ProcessedEventRepository repository;
    private final BillingMetrics metrics;
    private final Clock clock;

    @Transactional
    public Outcome processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Supplier<BillingResult<?>> handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            metrics.recordEventProcessed(eventType, false);
            return Outcome.DUPLICATE;
        }

        BillingResult<?> result = handler.get();

        if (result.isSuccess()) {
            repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
                eventId, eventType, aggregateType, aggregateId, consumerGroup, clock.instant())));
            metrics.recordEventProcessed(eventType, true);
            log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
            return Outcome.PROCESSED;
        }

        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.failed(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, clock.instant(),
            result.getError().toString())));
        metrics.recordEventProcessingFailure(eventType, result.getError().getCode().name());
        log.warn("Event {} ({}) rejected: {}", eventId, eventType, result.getError());
        return Outcome.REJECTED;
    }

    /**
     * Records an event this consumer does not handle so it is not looked at again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
            eventId, eventType, aggregateType, aggregateId, consumerGroup, clock.instant(), reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    @Transactional(readOnly = true)
    public List<ProcessedEvent> getHistory(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(aggregateType, aggregateId)
            .stream()
            .map(ProcessedEventEntity::toDomain)
            .toList();
    }
}
