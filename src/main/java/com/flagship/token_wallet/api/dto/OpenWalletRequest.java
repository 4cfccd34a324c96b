package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class OpenWalletRequest {

    @NotBlank(message = "Wallet ID is required")
    @Size(max = 128, message = "Wallet ID must be at most 128 characters")
    @JsonProperty("wallet_id")
    String walletId;
}
