package com.flagship.token_wallet.escrow;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Booking cancellation windows (billing.escrow.*).
 */
@Configuration
@ConfigurationProperties(prefix = "billing.escrow")
@Validated
@Data
public class EscrowProperties {

    /**
     * Guests cancelling at least this long before the start get everything back.
     */
    @NotNull
    private Duration fullRefundNotice = Duration.ofHours(72);

    /**
     * Guests cancelling at least this long (but less than the full notice) before the
     * start get {@link #partialRefundFraction} back. Later cancellations get nothing.
     */
    @NotNull
    private Duration partialRefundNotice = Duration.ofHours(24);

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal partialRefundFraction = new BigDecimal("0.5");
}
