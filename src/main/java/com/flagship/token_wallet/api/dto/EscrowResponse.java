package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.escrow.EscrowRecord;
import com.flagship.token_wallet.escrow.EscrowStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EscrowResponse {

    @JsonProperty("escrow_id")
    UUID escrowId;

    @JsonProperty("booking_id")
    String bookingId;

    @JsonProperty("payer_id")
    String payerId;

    @JsonProperty("earner_id")
    String earnerId;

    @JsonProperty("gross_amount_minor")
    long grossAmountMinor;

    @JsonProperty("fee_amount_minor")
    long feeAmountMinor;

    @JsonProperty("held_amount_minor")
    long heldAmountMinor;

    @JsonProperty("refunded_amount_minor")
    long refundedAmountMinor;

    @JsonProperty("released_amount_minor")
    long releasedAmountMinor;

    @JsonProperty("status")
    EscrowStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("resolved_at")
    Instant resolvedAt;

    public static EscrowResponse from(EscrowRecord escrow) {
        return EscrowResponse.builder()
            .escrowId(escrow.getEscrowId())
            .bookingId(escrow.getBookingId())
            .payerId(escrow.getPayerId())
            .earnerId(escrow.getEarnerId())
            .grossAmountMinor(escrow.getGrossAmountMinor())
            .feeAmountMinor(escrow.getFeeAmountMinor())
            .heldAmountMinor(escrow.getHeldAmountMinor())
            .refundedAmountMinor(escrow.getRefundedAmountMinor())
            .releasedAmountMinor(escrow.getReleasedAmountMinor())
            .status(escrow.getStatus())
            .createdAt(escrow.getCreatedAt())
            .resolvedAt(escrow.getResolvedAt())
            .build();
    }
}
