package com.flagship.token_wallet.event;

import com.flagship.token_wallet.pricing.RevenueSplit;
import com.flagship.token_wallet.session.BillingSession;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for every tick that moved money, with the unit range it covered.
 */
@Value
public class SessionChargedEvent implements BillingEvent {
    UUID eventId;
    UUID sessionId;
    String payerId;
    String earnerId;
    long fromUnit;
    long toUnit;
    long amountMinor;
    long earnerShareMinor;
    long platformShareMinor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SessionCharged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return sessionId;
    }

    public static SessionChargedEvent from(BillingSession session, long fromUnit, long toUnit,
                                           RevenueSplit split, Instant occurredAt) {
        return new SessionChargedEvent(
            UUID.randomUUID(),
            session.getSessionId(),
            session.getPayerId(),
            session.getEarnerId(),
            fromUnit,
            toUnit,
            split.getAmount(),
            split.getEarnerShare(),
            split.getPlatformShare(),
            occurredAt);
    }
}
