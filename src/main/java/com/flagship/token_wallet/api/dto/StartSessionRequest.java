package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.session.SessionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StartSessionRequest {

    @NotNull(message = "Session type is required")
    @JsonProperty("session_type")
    SessionType sessionType;

    @NotNull(message = "Participant A is required")
    @Valid
    @JsonProperty("participant_a")
    ParticipantRequest participantA;

    @NotNull(message = "Participant B is required")
    @Valid
    @JsonProperty("participant_b")
    ParticipantRequest participantB;

    @NotBlank(message = "Initiator ID is required")
    @JsonProperty("initiator_id")
    String initiatorId;
}
