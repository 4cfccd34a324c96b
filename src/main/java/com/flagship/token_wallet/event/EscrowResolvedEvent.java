package com.flagship.token_wallet.event;

import com.flagship.token_wallet.escrow.EscrowRecord;
import com.flagship.token_wallet.escrow.EscrowStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when held booking funds are released, refunded or split.
 */
@Value
public class EscrowResolvedEvent implements BillingEvent {
    UUID eventId;
    UUID escrowId;
    String bookingId;
    EscrowStatus status;
    long refundedAmountMinor;
    long releasedAmountMinor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EscrowResolved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return escrowId;
    }

    public static EscrowResolvedEvent from(EscrowRecord escrow) {
        return new EscrowResolvedEvent(
            UUID.randomUUID(),
            escrow.getEscrowId(),
            escrow.getBookingId(),
            escrow.getStatus(),
            escrow.getRefundedAmountMinor(),
            escrow.getReleasedAmountMinor(),
            escrow.getResolvedAt());
    }
}
