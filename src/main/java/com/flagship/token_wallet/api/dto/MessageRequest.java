package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MessageRequest {

    @NotBlank(message = "Sender ID is required")
    @JsonProperty("sender_id")
    String senderId;

    @NotNull(message = "Text is required")
    @JsonProperty("text")
    String text;
}
