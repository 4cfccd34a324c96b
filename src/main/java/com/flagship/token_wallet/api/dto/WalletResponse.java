package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.wallet.Wallet;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class WalletResponse {

    @JsonProperty("wallet_id")
    String walletId;

    @JsonProperty("balance_minor")
    long balanceMinor;

    @JsonProperty("version")
    long version;

    @JsonProperty("frozen")
    boolean frozen;

    @JsonProperty("closed")
    boolean closed;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
            .walletId(wallet.getWalletId())
            .balanceMinor(wallet.getBalanceMinor())
            .version(wallet.getVersion())
            .frozen(wallet.isFrozen())
            .closed(wallet.isClosed())
            .createdAt(wallet.getCreatedAt())
            .updatedAt(wallet.getUpdatedAt())
            .build();
    }
}
