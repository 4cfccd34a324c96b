package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.escrow.CancellationRefundPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * How to resolve a held booking.
 * <ul>
 *   <li>RELEASE: the held amount goes to the earner.</li>
 *   <li>REFUND: {@code refund_fraction} of it goes back to the payer, the rest to the earner.</li>
 *   <li>CANCEL: the refund fraction follows from {@code cancelled_by} and {@code booking_start}.</li>
 * </ul>
 */
@Value
@Builder
@Jacksonized
public class ResolutionRequest {

    public enum Action { RELEASE, REFUND, CANCEL }

    @NotNull(message = "Action is required")
    @JsonProperty("action")
    Action action;

    @DecimalMin(value = "0.0", message = "Refund fraction must be at least 0")
    @DecimalMax(value = "1.0", message = "Refund fraction must be at most 1")
    @JsonProperty("refund_fraction")
    BigDecimal refundFraction;

    @JsonProperty("cancelled_by")
    CancellationRefundPolicy.CancelledBy cancelledBy;

    @JsonProperty("booking_start")
    Instant bookingStart;
}
