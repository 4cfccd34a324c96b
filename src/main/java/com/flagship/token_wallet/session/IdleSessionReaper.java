package com.flagship.token_wallet.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Failsafe for sessions whose end event never arrived: periodically aborts sessions that
 * have been silent longer than their type's {@code billing.sessions.idle-timeout}.
 */
@Component
@ConditionalOnProperty(name = "billing.sessions.reaper.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class IdleSessionReaper {

    private final BillingOrchestrator orchestrator;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${billing.sessions.reaper.interval-ms:30000}")
    public void reap() {
        try {
            orchestrator.abortIdleSessions(clock.instant());
        } catch (Exception e) {
            log.error("Error in idle session reaper", e);
        }
    }
}
