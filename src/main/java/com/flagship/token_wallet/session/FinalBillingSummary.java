package com.flagship.token_wallet.session;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Totals of a finished (or still running) session.
 */
@Value
public class FinalBillingSummary {
    UUID sessionId;
    SessionType sessionType;
    String payerId;
    String earnerId;
    SessionState state;
    SessionEndReason endReason;
    long unitsBilled;
    long amountBilledMinor;
    long earnerAmountMinor;
    long platformAmountMinor;
    /** Units accrued but never charged because the payer ran out of funds. */
    long unbilledUnits;
    int freeMessagesUsed;
    Instant startedAt;
    Instant endedAt;

    public static FinalBillingSummary from(BillingSession session) {
        return new FinalBillingSummary(
            session.getSessionId(),
            session.getSessionType(),
            session.getPayerId(),
            session.getEarnerId(),
            session.getState(),
            session.getEndReason(),
            session.getUnitsBilled(),
            session.getAmountBilledMinor(),
            session.getEarnerAmountMinor(),
            session.getAmountBilledMinor() - session.getEarnerAmountMinor(),
            session.getUnitsPending(),
            session.getFreeMessagesUsed(),
            session.getStartedAt(),
            session.getEndedAt());
    }
}
