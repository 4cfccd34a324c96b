package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.pricing.BillingUnit;
import com.flagship.token_wallet.session.SessionHandle;
import com.flagship.token_wallet.session.SessionState;
import com.flagship.token_wallet.session.SessionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SessionResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("session_type")
    SessionType sessionType;

    @JsonProperty("payer_id")
    String payerId;

    /** Null when the platform earns the whole charge. */
    @JsonProperty("earner_id")
    String earnerId;

    @JsonProperty("billing_unit")
    BillingUnit billingUnit;

    @JsonProperty("unit_size")
    int unitSize;

    @JsonProperty("price_per_unit")
    long pricePerUnit;

    @JsonProperty("state")
    SessionState state;

    @JsonProperty("started_at")
    Instant startedAt;

    public static SessionResponse from(SessionHandle handle) {
        return SessionResponse.builder()
            .sessionId(handle.getSessionId())
            .sessionType(handle.getSessionType())
            .payerId(handle.getPayerId())
            .earnerId(handle.getEarnerId())
            .billingUnit(handle.getBillingUnit())
            .unitSize(handle.getUnitSize())
            .pricePerUnit(handle.getPricePerUnit())
            .state(handle.getState())
            .startedAt(handle.getStartedAt())
            .build();
    }
}
