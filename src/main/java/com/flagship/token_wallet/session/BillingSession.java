package com.flagship.token_wallet.session;

import com.flagship.token_wallet.metering.FreeChatAllowance;
import com.flagship.token_wallet.pricing.BillingUnit;
import com.flagship.token_wallet.pricing.SubscriptionTier;
import com.flagship.token_wallet.pricing.UnitPrice;
import com.flagship.token_wallet.roles.RoleResolution;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Billing session domain object.
 *
 * Payer, earner and price are frozen when the session is created; later profile or pricing
 * changes only affect new sessions. State changes return a new instance and illegal
 * transitions throw {@link IllegalStateException}.
 */
@Value
@Builder(toBuilder = true)
public class BillingSession {
    UUID sessionId;
    SessionType sessionType;
    String participantA;
    String participantB;
    String initiatorId;
    String payerId;
    /** Null when the platform is the sole earner. */
    String earnerId;
    SubscriptionTier payerTier;
    BillingUnit billingUnit;
    int unitSize;
    long pricePerUnit;
    int earnerRateBps;
    /** Raw usage: words or seconds. */
    long usageAccrued;
    long unitsPending;
    long unitsBilled;
    long amountBilledMinor;
    long earnerAmountMinor;
    int freeMessagesPerParticipant;
    /** {@link FreeChatAllowance#UNLIMITED} when the pool has no cap. */
    int freePoolLimit;
    int freeMessagesUsedA;
    int freeMessagesUsedB;
    int freePoolMessagesUsed;
    SessionState state;
    SessionEndReason endReason;
    Instant startedAt;
    Instant lastActivityAt;
    Instant endedAt;
    Long version;

    /**
     * Creates a new session in PENDING_START.
     */
    public static BillingSession create(UUID sessionId, SessionType sessionType,
                                        String participantA, String participantB, String initiatorId,
                                        RoleResolution roles, SubscriptionTier payerTier,
                                        UnitPrice price, FreeChatAllowance freeChat, Instant now) {
        return BillingSession.builder()
            .sessionId(sessionId)
            .sessionType(sessionType)
            .participantA(participantA)
            .participantB(participantB)
            .initiatorId(initiatorId)
            .payerId(roles.getPayerId())
            .earnerId(roles.getEarnerId())
            .payerTier(payerTier)
            .billingUnit(price.getBillingUnit())
            .unitSize(price.getUnitSize())
            .pricePerUnit(price.getPricePerUnit())
            .earnerRateBps(price.getEarnerRateBps())
            .freeMessagesPerParticipant(freeChat.getPerParticipant())
            .freePoolLimit(freeChat.getPoolLimit())
            .state(SessionState.PENDING_START)
            .startedAt(now)
            .lastActivityAt(now)
            .build();
    }

    /**
     * Transitions the session to ACTIVE. Only valid from PENDING_START.
     */
    public BillingSession activate(Instant now) {
        if (state != SessionState.PENDING_START) {
            throw new IllegalStateException(
                String.format("Cannot activate session in %s state. Only PENDING_START sessions can be activated.", state));
        }
        return toBuilder().state(SessionState.ACTIVE).lastActivityAt(now).build();
    }

    public BillingSession withUsage(long usageAccrued, long unitsPending, Instant now) {
        requireActive("record usage");
        return toBuilder()
            .usageAccrued(usageAccrued)
            .unitsPending(unitsPending)
            .lastActivityAt(now)
            .build();
    }

    /**
     * Records units that were charged to the payer.
     */
    public BillingSession recordBilled(long units, long amountMinor, long earnerShareMinor) {
        requireActive("bill");
        if (units <= 0 || units > unitsPending) {
            throw new IllegalStateException(
                String.format("Cannot bill %d units, %d are pending on session %s", units, unitsPending, sessionId));
        }
        return toBuilder()
            .unitsPending(unitsPending - units)
            .unitsBilled(unitsBilled + units)
            .amountBilledMinor(amountBilledMinor + amountMinor)
            .earnerAmountMinor(earnerAmountMinor + earnerShareMinor)
            .build();
    }

    public boolean hasFreeMessageLeft(String senderId) {
        return freeMessagesUsedBy(senderId) < freeMessagesPerParticipant;
    }

    /**
     * Spends one of the sender's own free messages.
     */
    public BillingSession useFreeMessage(String senderId, Instant now) {
        requireActive("use a free message on");
        if (!hasFreeMessageLeft(senderId)) {
            throw new IllegalStateException(
                String.format("%s has no free messages left on session %s", senderId, sessionId));
        }
        BillingSessionBuilder builder = toBuilder().lastActivityAt(now);
        if (participantA.equals(senderId)) {
            builder.freeMessagesUsedA(freeMessagesUsedA + 1);
        } else {
            builder.freeMessagesUsedB(freeMessagesUsedB + 1);
        }
        return builder.build();
    }

    public boolean hasFreePoolMessageLeft() {
        return freePoolLimit == FreeChatAllowance.UNLIMITED || freePoolMessagesUsed < freePoolLimit;
    }

    public BillingSession useFreePoolMessage(Instant now) {
        requireActive("use the free pool of");
        if (!hasFreePoolMessageLeft()) {
            throw new IllegalStateException(
                String.format("Free pool of session %s is used up", sessionId));
        }
        return toBuilder()
            .freePoolMessagesUsed(freePoolMessagesUsed + 1)
            .lastActivityAt(now)
            .build();
    }

    /**
     * All messages that were not billed, from personal allowances and the pool.
     */
    public int getFreeMessagesUsed() {
        return freeMessagesUsedA + freeMessagesUsedB + freePoolMessagesUsed;
    }

    public BillingSession touch(Instant now) {
        requireActive("record activity on");
        return toBuilder().lastActivityAt(now).build();
    }

    /**
     * Transitions the session to ENDED. Only valid from ACTIVE.
     */
    public BillingSession end(SessionEndReason reason, Instant now) {
        requireActive("end");
        return toBuilder().state(SessionState.ENDED).endReason(reason).endedAt(now).build();
    }

    /**
     * Transitions the session to ABORTED after the idle timeout. Only valid from ACTIVE.
     */
    public BillingSession abort(Instant now) {
        requireActive("abort");
        return toBuilder()
            .state(SessionState.ABORTED)
            .endReason(SessionEndReason.IDLE_TIMEOUT)
            .endedAt(now)
            .build();
    }

    public boolean isTerminal() {
        return state == SessionState.ENDED || state == SessionState.ABORTED;
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    public boolean isParticipant(String userId) {
        return participantA.equals(userId) || participantB.equals(userId);
    }

    private int freeMessagesUsedBy(String userId) {
        if (participantA.equals(userId)) {
            return freeMessagesUsedA;
        }
        if (participantB.equals(userId)) {
            return freeMessagesUsedB;
        }
        throw new IllegalArgumentException(
            String.format("%s is not a participant of session %s", userId, sessionId));
    }

    public boolean isIdleSince(Instant cutoff) {
        return lastActivityAt.isBefore(cutoff);
    }

    public boolean canTransitionTo(SessionState target) {
        if (state == target) {
            return true;
        }
        return switch (state) {
            case PENDING_START -> target == SessionState.ACTIVE;
            case ACTIVE -> target == SessionState.ENDED || target == SessionState.ABORTED;
            case ENDED, ABORTED -> false;
        };
    }

    private void requireActive(String action) {
        if (state != SessionState.ACTIVE) {
            throw new IllegalStateException(
                String.format("Cannot %s session %s in %s state", action, sessionId, state));
        }
    }
}
