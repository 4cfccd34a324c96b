package com.flagship.token_wallet.escrow;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Maps a booking cancellation to a refund outcome.
 *
 * Host cancellations are always refunded in full. Guest cancellations are refunded by
 * notice: at least 72 hours before the start in full, at least 24 hours by half,
 * otherwise not at all (the held amount goes to the host).
 */
@Component
@RequiredArgsConstructor
public class CancellationRefundPolicy {

    public enum CancelledBy { HOST, GUEST }

    private final EscrowProperties properties;

    public BookingOutcome outcomeFor(CancelledBy cancelledBy, Instant bookingStart, Instant cancelledAt) {
        if (cancelledBy == CancelledBy.HOST) {
            return BookingOutcome.fullRefund();
        }
        Duration notice = Duration.between(cancelledAt, bookingStart);
        if (notice.compareTo(properties.getFullRefundNotice()) >= 0) {
            return BookingOutcome.fullRefund();
        }
        if (notice.compareTo(properties.getPartialRefundNotice()) >= 0) {
            return BookingOutcome.refund(properties.getPartialRefundFraction());
        }
        return BookingOutcome.refund(BigDecimal.ZERO);
    }
}
