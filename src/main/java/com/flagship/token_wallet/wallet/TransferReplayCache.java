package com.flagship.token_wallet.wallet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Optional;

/**
 * Redis fast-path for replayed transfer ids.
 *
 * Strategy:
 * 1. Look the transaction id up in Redis first
 * 2. On a miss, or when Redis is down, the ledger reads the database
 * 3. Committed transactions are written back to Redis after the commit
 *
 * The database stays the source of truth. Redis is optional: without a Redis connection
 * every lookup is a miss.
 */
@Service
@Slf4j
public class TransferReplayCache {

    private static final String REDIS_KEY_PREFIX = "ledger-tx:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerProperties properties;

    public TransferReplayCache(Optional<StringRedisTemplate> redisTemplate,
                               ObjectMapper objectMapper,
                               LedgerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public Optional<LedgerTransaction> find(String transactionId) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + transactionId);
            if (json == null) {
                return Optional.empty();
            }
            log.debug("Transaction {} found in Redis", transactionId);
            return Optional.of(objectMapper.readValue(json, LedgerTransaction.class));
        } catch (Exception e) {
            log.warn("Redis lookup failed for transaction {}. Falling back to database. Error: {}",
                transactionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Caches the transactions once the surrounding database transaction has committed,
     * so a rolled back transfer is never served from Redis.
     */
    public void storeAfterCommit(List<LedgerTransaction> transactions) {
        if (redisTemplate.isEmpty() || transactions.isEmpty()) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    store(transactions);
                }
            });
        } else {
            store(transactions);
        }
    }

    private void store(List<LedgerTransaction> transactions) {
        for (LedgerTransaction transaction : transactions) {
            try {
                redisTemplate.get().opsForValue().set(
                    REDIS_KEY_PREFIX + transaction.getTransactionId(),
                    objectMapper.writeValueAsString(transaction),
                    properties.getReplayCacheTtl());
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize transaction " + transaction.getTransactionId(), e);
            } catch (Exception e) {
                log.warn("Failed to cache transaction {} in Redis: {}", transaction.getTransactionId(), e.getMessage());
            }
        }
    }
}
