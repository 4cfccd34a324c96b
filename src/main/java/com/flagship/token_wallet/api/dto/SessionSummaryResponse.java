package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.session.FinalBillingSummary;
import com.flagship.token_wallet.session.SessionEndReason;
import com.flagship.token_wallet.session.SessionState;
import com.flagship.token_wallet.session.SessionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SessionSummaryResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("session_type")
    SessionType sessionType;

    @JsonProperty("payer_id")
    String payerId;

    @JsonProperty("earner_id")
    String earnerId;

    @JsonProperty("state")
    SessionState state;

    @JsonProperty("end_reason")
    SessionEndReason endReason;

    @JsonProperty("units_billed")
    long unitsBilled;

    @JsonProperty("amount_billed_minor")
    long amountBilledMinor;

    @JsonProperty("earner_amount_minor")
    long earnerAmountMinor;

    @JsonProperty("platform_amount_minor")
    long platformAmountMinor;

    @JsonProperty("unbilled_units")
    long unbilledUnits;

    @JsonProperty("free_messages_used")
    int freeMessagesUsed;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("ended_at")
    Instant endedAt;

    public static SessionSummaryResponse from(FinalBillingSummary summary) {
        return SessionSummaryResponse.builder()
            .sessionId(summary.getSessionId())
            .sessionType(summary.getSessionType())
            .payerId(summary.getPayerId())
            .earnerId(summary.getEarnerId())
            .state(summary.getState())
            .endReason(summary.getEndReason())
            .unitsBilled(summary.getUnitsBilled())
            .amountBilledMinor(summary.getAmountBilledMinor())
            .earnerAmountMinor(summary.getEarnerAmountMinor())
            .platformAmountMinor(summary.getPlatformAmountMinor())
            .unbilledUnits(summary.getUnbilledUnits())
            .freeMessagesUsed(summary.getFreeMessagesUsed())
            .startedAt(summary.getStartedAt())
            .endedAt(summary.getEndedAt())
            .build();
    }
}
