package com.flagship.token_wallet.event;

import com.flagship.token_wallet.pricing.BillingUnit;
import com.flagship.token_wallet.session.BillingSession;
import com.flagship.token_wallet.session.SessionType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a session passes the funding check and becomes ACTIVE.
 */
@Value
public class SessionStartedEvent implements BillingEvent {
    UUID eventId;
    UUID sessionId;
    SessionType sessionType;
    String payerId;
    String earnerId;
    BillingUnit billingUnit;
    int unitSize;
    long pricePerUnit;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionStarted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return sessionId;
    }

    public static SessionStartedEvent from(BillingSession session) {
        return new SessionStartedEvent(
            UUID.randomUUID(),
            session.getSessionId(),
            session.getSessionType(),
            session.getPayerId(),
            session.getEarnerId(),
            session.getBillingUnit(),
            session.getUnitSize(),
            session.getPricePerUnit(),
            session.getStartedAt());
    }
}
