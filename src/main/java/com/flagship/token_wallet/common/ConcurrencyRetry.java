package com.flagship.token_wallet.common;

import com.flagship.token_wallet.observability.BillingMetrics;
import com.flagship.token_wallet.wallet.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.function.Supplier;

/**
 * Bounded retry for units of work that lose an optimistic compare-and-set or a lock race.
 *
 * Each attempt must open its own transaction, so the retry only loops when no transaction
 * is active on the calling thread. Inside an outer transaction the conflict propagates and
 * the outermost caller decides (a Kafka listener, for instance, lets the record be redelivered).
 *
 * When the attempts run out the caller receives {@link ErrorCode#CONCURRENT_MODIFICATION}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConcurrencyRetry {

    private final LedgerProperties properties;
    private final BillingMetrics metrics;

    public <T> BillingResult<T> execute(String operation, Supplier<BillingResult<T>> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }

        int maxAttempts = properties.getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return work.get();
            } catch (ConcurrencyFailureException | DuplicateKeyException e) {
                metrics.recordRetry(operation);
                if (attempt >= maxAttempts) {
                    log.warn("{} still conflicting after {} attempts: {}", operation, attempt, e.getMessage());
                    return BillingResult.failure(ErrorCode.CONCURRENT_MODIFICATION,
                        operation + " lost " + attempt + " concurrent update races, retry later");
                }
                log.debug("{} attempt {} of {} conflicted, retrying: {}", operation, attempt, maxAttempts, e.getMessage());
                backoff(attempt);
            }
        }
    }

    private void backoff(int attempt) {
        try {
            Thread.sleep(properties.getBackoffMillis() * attempt);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
