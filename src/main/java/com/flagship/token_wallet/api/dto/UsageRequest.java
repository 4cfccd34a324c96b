package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.metering.UsageMeter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Raw usage in the session's unit: words for chats, elapsed seconds for calls.
 */
@Value
@Builder
@Jacksonized
public class UsageRequest {

    @NotNull(message = "Units are required")
    @PositiveOrZero(message = "Units must not be negative")
    @Max(value = UsageMeter.MAX_USAGE_PER_REPORT, message = "Usage report too large")
    @JsonProperty("units")
    Long units;
}
