package com.flagship.token_wallet.session;

import com.flagship.token_wallet.pricing.BillingUnit;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * What a caller needs to know about a session it just started.
 */
@Value
public class SessionHandle {
    UUID sessionId;
    SessionType sessionType;
    String payerId;
    String earnerId;
    BillingUnit billingUnit;
    int unitSize;
    long pricePerUnit;
    SessionState state;
    Instant startedAt;

    public static SessionHandle from(BillingSession session) {
        return new SessionHandle(
            session.getSessionId(),
            session.getSessionType(),
            session.getPayerId(),
            session.getEarnerId(),
            session.getBillingUnit(),
            session.getUnitSize(),
            session.getPricePerUnit(),
            session.getState(),
            session.getStartedAt());
    }
}
