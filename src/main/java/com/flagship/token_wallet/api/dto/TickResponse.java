package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.session.SessionState;
import com.flagship.token_wallet.session.TickOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class TickResponse {

    @JsonProperty("session_id")
    UUID sessionId;

    @JsonProperty("status")
    TickOutcome.Status status;

    @JsonProperty("units_billed")
    long unitsBilled;

    @JsonProperty("amount_billed_minor")
    long amountBilledMinor;

    @JsonProperty("total_units_billed")
    long totalUnitsBilled;

    @JsonProperty("session_state")
    SessionState sessionState;

    /** The chat or call must be cut off. */
    @JsonProperty("terminate")
    boolean terminate;

    public static TickResponse from(TickOutcome outcome) {
        return TickResponse.builder()
            .sessionId(outcome.getSessionId())
            .status(outcome.getStatus())
            .unitsBilled(outcome.getUnitsBilled())
            .amountBilledMinor(outcome.getAmountBilledMinor())
            .totalUnitsBilled(outcome.getTotalUnitsBilled())
            .sessionState(outcome.getSessionState())
            .terminate(outcome.isTerminateInteraction())
            .build();
    }
}
