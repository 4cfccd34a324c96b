package com.flagship.token_wallet.event;

import com.flagship.token_wallet.session.BillingSession;
import com.flagship.token_wallet.session.SessionEndReason;
import com.flagship.token_wallet.session.SessionState;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a session reaches ENDED or ABORTED.
 * Chat and call services listen for INSUFFICIENT_FUNDS to cut the interaction off.
 */
@Value
public class SessionEndedEvent implements BillingEvent {
    UUID eventId;
    UUID sessionId;
    SessionState state;
    SessionEndReason endReason;
    long unitsBilled;
    long amountBilledMinor;
    long earnerAmountMinor;
    long unbilledUnits;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionEnded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return sessionId;
    }

    public static SessionEndedEvent from(BillingSession session) {
        return new SessionEndedEvent(
            UUID.randomUUID(),
            session.getSessionId(),
            session.getState(),
            session.getEndReason(),
            session.getUnitsBilled(),
            session.getAmountBilledMinor(),
            session.getEarnerAmountMinor(),
            session.getUnitsPending(),
            session.getEndedAt());
    }
}
