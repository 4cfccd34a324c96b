package com.flagship.token_wallet.consumer;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.common.ErrorCode;
import com.flagship.token_wallet.session.BillingOrchestrator;
import com.flagship.token_wallet.session.FinalBillingSummary;
import com.flagship.token_wallet.session.TickOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Translates inbound usage events into orchestrator calls.
 *
 * Deduplication is handled by {@link IdempotentEventProcessor} before these run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageEventHandler {

    private final BillingOrchestrator orchestrator;

    public BillingResult<TickOutcome> onMessageSent(MessageSentEvent event) {
        BillingResult<TickOutcome> result =
            orchestrator.recordMessage(event.getSessionId(), event.getSenderId(), event.getText());
        logTermination(result);
        return result;
    }

    /**
     * A heartbeat with talk time meters it; an empty one only keeps the session alive.
     */
    public BillingResult<TickOutcome> onCallHeartbeat(CallHeartbeatEvent event) {
        if (event.getElapsedSeconds() < 0) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST,
                "Negative elapsed time in heartbeat " + event.getEventId());
        }
        BillingResult<TickOutcome> result = event.getElapsedSeconds() > 0
            ? orchestrator.recordUsage(event.getSessionId(), event.getElapsedSeconds())
            : orchestrator.heartbeat(event.getSessionId());
        logTermination(result);
        return result;
    }

    public BillingResult<TickOutcome> onUsageRecorded(UsageRecordedEvent event) {
        BillingResult<TickOutcome> result = orchestrator.recordUsage(event.getSessionId(), event.getUnits());
        logTermination(result);
        return result;
    }

    /**
     * Closing an already finished session is not an error for the event stream: the
     * reaper or an insufficient-funds tick may have ended it first.
     */
    public BillingResult<FinalBillingSummary> onSessionClosed(SessionClosedEvent event) {
        BillingResult<FinalBillingSummary> result = orchestrator.endSession(event.getSessionId());
        if (result.hasError(ErrorCode.INVALID_SESSION_STATE)) {
            return orchestrator.getSummary(event.getSessionId());
        }
        return result;
    }

    private void logTermination(BillingResult<TickOutcome> result) {
        if (result.isSuccess() && result.getValue().getStatus() == TickOutcome.Status.INSUFFICIENT_FUNDS) {
            log.info("Session {} ran out of funds, interaction must be terminated",
                result.getValue().getSessionId());
        }
    }
}
