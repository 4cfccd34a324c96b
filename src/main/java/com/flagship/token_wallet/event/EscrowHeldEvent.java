package com.flagship.token_wallet.event;

import com.flagship.token_wallet.escrow.EscrowRecord;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EscrowHeldEvent implements BillingEvent {
    UUID eventId;
    UUID escrowId;
    String bookingId;
    String payerId;
    String earnerId;
    long grossAmountMinor;
    long feeAmountMinor;
    long heldAmountMinor;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EscrowHeld";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return escrowId;
    }

    public static EscrowHeldEvent from(EscrowRecord escrow) {
        return new EscrowHeldEvent(
            UUID.randomUUID(),
            escrow.getEscrowId(),
            escrow.getBookingId(),
            escrow.getPayerId(),
            escrow.getEarnerId(),
            escrow.getGrossAmountMinor(),
            escrow.getFeeAmountMinor(),
            escrow.getHeldAmountMinor(),
            escrow.getCreatedAt());
    }
}
