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
 * Top-up (tokens bought through the payment provider) or payout (tokens cashed out).
 * The transaction id makes retries of the same request safe.
 */
@Value
@Builder
@Jacksonized
public class AmountRequest {

    @NotBlank(message = "Transaction ID is required")
    @JsonProperty("transaction_id")
    String transactionId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @Max(value = TransferRequest.MAX_AMOUNT_MINOR, message = "Amount exceeds the per-transfer limit")
    @JsonProperty("amount_minor")
    Long amountMinor;

    /** Payment provider or payout reference, stored as the related id. */
    @JsonProperty("reference")
    String reference;
}
