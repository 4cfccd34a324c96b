package com.flagship.token_wallet.escrow;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Funds of one booking parked in the platform escrow wallet.
 *
 * {@code gross = held + fee}. The fee goes to the platform when the hold is placed
 * and is never refunded; {@code held} is later released to the earner or refunded to
 * the payer, in full or in part.
 */
@Value
@Builder(toBuilder = true)
public class EscrowRecord {
    UUID escrowId;
    String bookingId;
    String payerId;
    String earnerId;
    long grossAmountMinor;
    long feeAmountMinor;
    long heldAmountMinor;
    long refundedAmountMinor;
    long releasedAmountMinor;
    EscrowStatus status;
    Instant createdAt;
    Instant resolvedAt;
    Long version;

    public static EscrowRecord hold(UUID escrowId, String bookingId, String payerId, String earnerId,
                                    long grossAmountMinor, long feeAmountMinor, Instant now) {
        return EscrowRecord.builder()
            .escrowId(escrowId)
            .bookingId(bookingId)
            .payerId(payerId)
            .earnerId(earnerId)
            .grossAmountMinor(grossAmountMinor)
            .feeAmountMinor(feeAmountMinor)
            .heldAmountMinor(grossAmountMinor - feeAmountMinor)
            .status(EscrowStatus.HELD)
            .createdAt(now)
            .build();
    }

    /**
     * Splits the held amount: {@code refundMinor} back to the payer, the rest to the earner.
     * A zero refund is a release.
     */
    public EscrowRecord resolve(long refundMinor, Instant now) {
        if (status != EscrowStatus.HELD) {
            throw new IllegalStateException(
                String.format("Cannot resolve escrow %s in %s state. Only HELD escrows can be resolved.", escrowId, status));
        }
        if (refundMinor < 0 || refundMinor > heldAmountMinor) {
            throw new IllegalArgumentException(
                String.format("Refund %d outside [0, %d] for escrow %s", refundMinor, heldAmountMinor, escrowId));
        }
        EscrowStatus resolved = refundMinor == 0 ? EscrowStatus.RELEASED
            : refundMinor == heldAmountMinor ? EscrowStatus.REFUNDED
            : EscrowStatus.PARTIALLY_REFUNDED;
        return toBuilder()
            .refundedAmountMinor(refundMinor)
            .releasedAmountMinor(heldAmountMinor - refundMinor)
            .status(resolved)
            .resolvedAt(now)
            .build();
    }

    public boolean isHeld() {
        return status == EscrowStatus.HELD;
    }

    /**
     * True when this escrow was opened with exactly these booking parameters.
     */
    public boolean matches(String payerId, String earnerId, long grossAmountMinor) {
        return this.payerId.equals(payerId)
            && this.earnerId.equals(earnerId)
            && this.grossAmountMinor == grossAmountMinor;
    }
}
