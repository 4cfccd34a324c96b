package com.flagship.token_wallet.roles;

import com.flagship.token_wallet.pricing.SubscriptionTier;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a participant's monetization attributes at session start.
 */
@Value
@Builder
public class ParticipantProfile {
    String userId;
    /** Opaque user class used by the asymmetric pairing rule. */
    String category;
    boolean earnerEligible;
    /** Influencer-style monetization switched on. */
    boolean monetizationActive;
    @Builder.Default
    SubscriptionTier tier = SubscriptionTier.STANDARD;
    @Builder.Default
    Popularity popularity = Popularity.HIGH;
    int accountAgeDays;
    /** Set by trust and safety; a restricted user never chats from the free pool. */
    boolean freePoolRestricted;

    boolean isMonetizedEarner() {
        return earnerEligible && monetizationActive;
    }
}
