package com.flagship.token_wallet.escrow;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How a booking ends: the held amount is released to the earner, or a fraction of it
 * is refunded to the payer with the remainder released.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BookingOutcome {

    public enum Type { RELEASE, REFUND }

    Type type;
    /** Fraction of the held amount refunded, in [0, 1]. Zero for a release. */
    BigDecimal refundFraction;

    public static BookingOutcome release() {
        return new BookingOutcome(Type.RELEASE, BigDecimal.ZERO);
    }

    public static BookingOutcome refund(BigDecimal fraction) {
        if (fraction == null || fraction.signum() < 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Refund fraction must be within [0, 1]: " + fraction);
        }
        return new BookingOutcome(Type.REFUND, fraction);
    }

    public static BookingOutcome fullRefund() {
        return refund(BigDecimal.ONE);
    }

    /**
     * {@code floor(held * fraction)}.
     */
    public long refundAmount(long heldAmountMinor) {
        return BigDecimal.valueOf(heldAmountMinor)
            .multiply(refundFraction)
            .setScale(0, RoundingMode.FLOOR)
            .longValueExact();
    }
}
