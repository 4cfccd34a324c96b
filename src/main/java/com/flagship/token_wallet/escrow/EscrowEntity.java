package com.flagship.token_wallet.escrow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for escrow_records. Amounts fixed at hold time are not updatable.
 */
@Entity
@Table(name = "escrow_records", uniqueConstraints = {
    @UniqueConstraint(name = "uq_escrow_records_booking", columnNames = "booking_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EscrowEntity {

    @Id
    @Column(name = "escrow_id", nullable = false, updatable = false)
    private UUID escrowId;

    @Column(name = "booking_id", nullable = false, updatable = false)
    private String bookingId;

    @Column(name = "payer_id", nullable = false, updatable = false)
    private String payerId;

    @Column(name = "earner_id", nullable = false, updatable = false)
    private String earnerId;

    @Column(name = "gross_amount_minor", nullable = false, updatable = false)
    private long grossAmountMinor;

    @Column(name = "fee_amount_minor", nullable = false, updatable = false)
    private long feeAmountMinor;

    @Column(name = "held_amount_minor", nullable = false, updatable = false)
    private long heldAmountMinor;

    @Column(name = "refunded_amount_minor", nullable = false)
    private long refundedAmountMinor;

    @Column(name = "released_amount_minor", nullable = false)
    private long releasedAmountMinor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EscrowStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    static EscrowEntity fromDomain(EscrowRecord escrow) {
        EscrowEntity entity = new EscrowEntity();
        entity.escrowId = escrow.getEscrowId();
        entity.bookingId = escrow.getBookingId();
        entity.payerId = escrow.getPayerId();
        entity.earnerId = escrow.getEarnerId();
        entity.grossAmountMinor = escrow.getGrossAmountMinor();
        entity.feeAmountMinor = escrow.getFeeAmountMinor();
        entity.heldAmountMinor = escrow.getHeldAmountMinor();
        entity.refundedAmountMinor = escrow.getRefundedAmountMinor();
        entity.releasedAmountMinor = escrow.getReleasedAmountMinor();
        entity.status = escrow.getStatus();
        entity.createdAt = escrow.getCreatedAt();
        entity.resolvedAt = escrow.getResolvedAt();
        return entity;
    }

    EscrowRecord toDomain() {
        return EscrowRecord.builder()
            .escrowId(escrowId)
            .bookingId(bookingId)
            .payerId(payerId)
            .earnerId(earnerId)
            .grossAmountMinor(grossAmountMinor)
            .feeAmountMinor(feeAmountMinor)
            .heldAmountMinor(heldAmountMinor)
            .refundedAmountMinor(refundedAmountMinor)
            .releasedAmountMinor(releasedAmountMinor)
            .status(status)
            .createdAt(createdAt)
            .resolvedAt(resolvedAt)
            .version(version)
            .build();
    }

    void applyResolution(EscrowRecord escrow) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Escrow " + escrowId + " is already " + status);
        }
        this.refundedAmountMinor = escrow.getRefundedAmountMinor();
        this.releasedAmountMinor = escrow.getReleasedAmountMinor();
        this.status = escrow.getStatus();
        this.resolvedAt = escrow.getResolvedAt();
    }
}
