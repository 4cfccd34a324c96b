package com.flagship.token_wallet.observability;

import com.flagship.token_wallet.session.SessionPersistenceService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final BillingMetrics billingMetrics;
    private final SessionPersistenceService sessionPersistence;

    private final AtomicLong activeSessions = new AtomicLong(0);

    @PostConstruct
    public void init() {
        billingMetrics.registerActiveSessionsGauge(activeSessions::get);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            activeSessions.set(sessionPersistence.countActive());
        } catch (Exception e) {
            log.warn("Failed to refresh active session gauge: {}", e.getMessage());
        }
    }
}
