package com.flagship.token_wallet.pricing;

import com.flagship.token_wallet.session.SessionType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Pricing lookups per feature and subscription tier.
 *
 * Pure functions over {@link PricingProperties}; nothing here touches a wallet.
 */
@Service
@RequiredArgsConstructor
public class PricingRuleStore {

    public static final int BASIS_POINTS = 10_000;
    public static final int SECONDS_PER_MINUTE = 60;

    private final PricingProperties properties;

    /**
     * Unit price for a new session, based on the payer's tier.
     */
    public UnitPrice priceFor(SessionType sessionType, SubscriptionTier payerTier) {
        return switch (sessionType) {
            case CHAT -> new UnitPrice(
                BillingUnit.WORD_BUCKET,
                bucketSize(payerTier),
                properties.getChat().getBucketPrice(),
                properties.getChat().getEarnerRateBps());
            case VOICE_CALL -> new UnitPrice(
                BillingUnit.MINUTE,
                SECONDS_PER_MINUTE,
                minutePrice(properties.getCall().getVoiceMinutePrice(), payerTier),
                properties.getCall().getEarnerRateBps());
            case VIDEO_CALL -> new UnitPrice(
                BillingUnit.MINUTE,
                SECONDS_PER_MINUTE,
                minutePrice(properties.getCall().getVideoMinutePrice(), payerTier),
                properties.getCall().getEarnerRateBps());
        };
    }

    public int bucketSize(SubscriptionTier tier) {
        Integer words = properties.getChat().getBucketWords().get(tier);
        if (words == null) {
            words = properties.getChat().getBucketWords().get(SubscriptionTier.STANDARD);
        }
        if (words == null || words <= 0) {
            throw new IllegalStateException("No chat bucket size configured for tier " + tier);
        }
        return words;
    }

    /**
     * Discounted per-minute price, rounded up.
     */
    long minutePrice(long basePrice, SubscriptionTier tier) {
        int discount = properties.getCall().getDiscountBps().getOrDefault(tier, 0);
        long payable = Math.multiplyExact(basePrice, (long) (BASIS_POINTS - discount));
        return Math.max(1L, ceilDiv(payable, BASIS_POINTS));
    }

    /**
     * Split of a booking price: the host share is held in escrow, the rest is the platform fee.
     */
    public RevenueSplit bookingSplit(long grossAmount) {
        return RevenueSplit.of(grossAmount, properties.getBooking().getHostShareBps());
    }

    public RevenueSplit split(long amount, int earnerRateBps) {
        return RevenueSplit.of(amount, earnerRateBps);
    }

    public static long ceilDiv(long dividend, long divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }
}
