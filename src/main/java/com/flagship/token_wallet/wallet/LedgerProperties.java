package com.flagship.token_wallet.wallet;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Ledger configuration (billing.ledger.*).
 */
@Configuration
@ConfigurationProperties(prefix = "billing.ledger")
@Validated
@Data
public class LedgerProperties {

    /**
     * Wallet that receives the platform's share of every charge.
     */
    @NotBlank
    private String platformWalletId = "platform-revenue";

    /**
     * Wallet that holds booking funds until the booking is resolved.
     */
    @NotBlank
    private String escrowWalletId = "platform-escrow";

    /**
     * Attempts per operation before reporting CONCURRENT_MODIFICATION.
     */
    @Positive
    private int maxAttempts = 5;

    /**
     * Base pause between attempts, multiplied by the attempt number.
     */
    @PositiveOrZero
    private long backoffMillis = 20L;

    /**
     * How long committed transactions stay in the Redis replay cache.
     */
    @NotNull
    private Duration replayCacheTtl = Duration.ofDays(7);
}
