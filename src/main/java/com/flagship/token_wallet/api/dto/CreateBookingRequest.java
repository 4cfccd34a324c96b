package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.wallet.TransferRequest;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Booking to hold in escrow. Supplying {@code booking_id} makes retries idempotent;
 * without it every request creates a new booking.
 */
@Value
@Builder
@Jacksonized
public class CreateBookingRequest {

    @JsonProperty("booking_id")
    String bookingId;

    @NotBlank(message = "Payer ID is required")
    @JsonProperty("payer_id")
    String payerId;

    @NotBlank(message = "Earner ID is required")
    @JsonProperty("earner_id")
    String earnerId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @Max(value = TransferRequest.MAX_AMOUNT_MINOR, message = "Amount exceeds the per-transfer limit")
    @JsonProperty("amount_minor")
    Long amountMinor;
}
