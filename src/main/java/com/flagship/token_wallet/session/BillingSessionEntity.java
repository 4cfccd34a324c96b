package com.flagship.token_wallet.session;

import com.flagship.token_wallet.pricing.BillingUnit;
import com.flagship.token_wallet.pricing.SubscriptionTier;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for billing sessions.
 *
 * Key design principles:
 * - No setters: state changes go through the {@link BillingSession} domain object
 * - Participants, roles and price are updatable = false, frozen at creation
 * - fromDomain() is the only way to create entities
 */
@Entity
@Table(
    name = "billing_sessions",
    indexes = {
        @Index(name = "idx_billing_sessions_state_activity", columnList = "state, last_activity_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BillingSessionEntity {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_type", nullable = false, updatable = false, length = 20)
    private SessionType sessionType;

    @Column(name = "participant_a", nullable = false, updatable = false)
    private String participantA;

    @Column(name = "participant_b", nullable = false, updatable = false)
    private String participantB;

    @Column(name = "initiator_id", nullable = false, updatable = false)
    private String initiatorId;

    @Column(name = "payer_id", nullable = false, updatable = false)
    private String payerId;

    @Column(name = "earner_id", updatable = false)
    private String earnerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "payer_tier", nullable = false, updatable = false, length = 20)
    private SubscriptionTier payerTier;

    @Enumerated(EnumType.STRING)
    @Column(name = "billing_unit", nullable = false, updatable = false, length = 20)
    private BillingUnit billingUnit;

    @Column(name = "unit_size", nullable = false, updatable = false)
    private int unitSize;

    @Column(name = "price_per_unit", nullable = false, updatable = false)
    private long pricePerUnit;

    @Column(name = "earner_rate_bps", nullable = false, updatable = false)
    private int earnerRateBps;

    @Column(name = "usage_accrued", nullable = false)
    private long usageAccrued;

    @Column(name = "units_pending", nullable = false)
    private long unitsPending;

    @Column(name = "units_billed", nullable = false)
    private long unitsBilled;

    @Column(name = "amount_billed_minor", nullable = false)
    private long amountBilledMinor;

    @Column(name = "earner_amount_minor", nullable = false)
    private long earnerAmountMinor;

    @Column(name = "free_messages_per_participant", nullable = false, updatable = false)
    private int freeMessagesPerParticipant;

    @Column(name = "free_pool_limit", nullable = false, updatable = false)
    private int freePoolLimit;

    @Column(name = "free_messages_used_a", nullable = false)
    private int freeMessagesUsedA;

    @Column(name = "free_messages_used_b", nullable = false)
    private int freeMessagesUsedB;

    @Column(name = "free_pool_messages_used", nullable = false)
    private int freePoolMessagesUsed;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SessionState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "end_reason", length = 30)
    private SessionEndReason endReason;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Version
    @Column(nullable = false)
    private Long version;

    static BillingSessionEntity fromDomain(BillingSession session) {
        return new BillingSessionEntity(
            session.getSessionId(),
            session.getSessionType(),
            session.getParticipantA(),
            session.getParticipantB(),
            session.getInitiatorId(),
            session.getPayerId(),
            session.getEarnerId(),
            session.getPayerTier(),
            session.getBillingUnit(),
            session.getUnitSize(),
            session.getPricePerUnit(),
            session.getEarnerRateBps(),
            session.getUsageAccrued(),
            session.getUnitsPending(),
            session.getUnitsBilled(),
            session.getAmountBilledMinor(),
            session.getEarnerAmountMinor(),
            session.getFreeMessagesPerParticipant(),
            session.getFreePoolLimit(),
            session.getFreeMessagesUsedA(),
            session.getFreeMessagesUsedB(),
            session.getFreePoolMessagesUsed(),
            session.getState(),
            session.getEndReason(),
            session.getStartedAt(),
            session.getLastActivityAt(),
            session.getEndedAt(),
            null // assigned by JPA on persist
        );
    }

    public BillingSession toDomain() {
        return BillingSession.builder()
            .sessionId(sessionId)
            .sessionType(sessionType)
            .participantA(participantA)
            .participantB(participantB)
            .initiatorId(initiatorId)
            .payerId(payerId)
            .earnerId(earnerId)
            .payerTier(payerTier)
            .billingUnit(billingUnit)
            .unitSize(unitSize)
            .pricePerUnit(pricePerUnit)
            .earnerRateBps(earnerRateBps)
            .usageAccrued(usageAccrued)
            .unitsPending(unitsPending)
            .unitsBilled(unitsBilled)
            .amountBilledMinor(amountBilledMinor)
            .earnerAmountMinor(earnerAmountMinor)
            .freeMessagesPerParticipant(freeMessagesPerParticipant)
            .freePoolLimit(freePoolLimit)
            .freeMessagesUsedA(freeMessagesUsedA)
            .freeMessagesUsedB(freeMessagesUsedB)
            .freePoolMessagesUsed(freePoolMessagesUsed)
            .state(state)
            .endReason(endReason)
            .startedAt(startedAt)
            .lastActivityAt(lastActivityAt)
            .endedAt(endedAt)
            .version(version)
            .build();
    }

    /**
     * Copies the mutable counters and lifecycle fields. Frozen fields cannot change.
     */
    void updateFromDomain(BillingSession session) {
        if (!state.equals(session.getState()) && !toDomain().canTransitionTo(session.getState())) {
            throw new IllegalStateException(String.format(
                "Session %s cannot move from %s to %s", sessionId, state, session.getState()));
        }
        this.usageAccrued = session.getUsageAccrued();
        this.unitsPending = session.getUnitsPending();
        this.unitsBilled = session.getUnitsBilled();
        this.amountBilledMinor = session.getAmountBilledMinor();
        this.earnerAmountMinor = session.getEarnerAmountMinor();
        this.freeMessagesUsedA = session.getFreeMessagesUsedA();
        this.freeMessagesUsedB = session.getFreeMessagesUsedB();
        this.freePoolMessagesUsed = session.getFreePoolMessagesUsed();
        this.state = session.getState();
        this.endReason = session.getEndReason();
        this.lastActivityAt = session.getLastActivityAt();
        this.endedAt = session.getEndedAt();
    }
}
