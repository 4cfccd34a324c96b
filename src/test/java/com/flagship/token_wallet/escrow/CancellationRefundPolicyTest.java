package com.flagship.token_wallet.escrow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CancellationRefundPolicyTest {

    private static final Instant START = Instant.parse("2024-06-10T18:00:00Z");

    private final CancellationRefundPolicy policy = new CancellationRefundPolicy(new EscrowProperties());

    private long refundOf400(CancellationRefundPolicy.CancelledBy by, Duration notice) {
        return policy.outcomeFor(by, START, START.minus(notice)).refundAmount(400);
    }

    @Test
    @DisplayName("Host cancellation always refunds everything")
    void hostCancels() {
        assertEquals(400, refundOf400(CancellationRefundPolicy.CancelledBy.HOST, Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("Guest with 72h notice or more gets a full refund")
    void guestEarly() {
        assertEquals(400, refundOf400(CancellationRefundPolicy.CancelledBy.GUEST, Duration.ofHours(72)));
        assertEquals(400, refundOf400(CancellationRefundPolicy.CancelledBy.GUEST, Duration.ofDays(10)));
    }

    @Test
    @DisplayName("Guest with 24h to 72h notice gets half back")
    void guestMid() {
        assertEquals(200, refundOf400(CancellationRefundPolicy.CancelledBy.GUEST, Duration.ofHours(24)));
        assertEquals(200, refundOf400(CancellationRefundPolicy.CancelledBy.GUEST, Duration.ofHours(71)));
    }

    @Test
    @DisplayName("Guest with less than 24h notice gets nothing back")
    void guestLate() {
        assertEquals(0, refundOf400(CancellationRefundPolicy.CancelledBy.GUEST, Duration.ofHours(23)));
        assertEquals(0, refundOf400(CancellationRefundPolicy.CancelledBy.GUEST, Duration.ofHours(-2)));
    }

    @Test
    @DisplayName("Refund amounts are rounded down")
    void refundFloors() {
        assertEquals(1, BookingOutcome.refund(new BigDecimal("0.5")).refundAmount(3));
        assertThrows(IllegalArgumentException.class, () -> BookingOutcome.refund(new BigDecimal("1.01")));
    }
}
