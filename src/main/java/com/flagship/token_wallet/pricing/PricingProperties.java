package com.flagship.token_wallet.pricing;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pricing tables (billing.pricing.*). All amounts are minor units, all rates basis points.
 */
@Configuration
@ConfigurationProperties(prefix = "billing.pricing")
@Validated
@Data
public class PricingProperties {

    @Valid
    private Chat chat = new Chat();

    @Valid
    private Call call = new Call();

    @Valid
    private Booking booking = new Booking();

    @Data
    public static class Chat {
        /**
         * Price of one word bucket.
         */
        @Positive
        private long bucketPrice = 1L;

        /**
         * Words per bucket, keyed by the payer's tier. Premium tiers get smaller buckets.
         */
        @NotEmpty
        private Map<SubscriptionTier, Integer> bucketWords = defaultBucketWords();

        /**
         * Share of every chat charge credited to the earner.
         */
        @Min(0)
        @Max(10_000)
        private int earnerRateBps = 6_500;

        /**
         * Messages each participant sends before any word is billed.
         */
        @Min(0)
        private int freeMessagesPerParticipant = 3;

        @Valid
        private FreePool freePool = new FreePool();

        private static Map<SubscriptionTier, Integer> defaultBucketWords() {
            Map<SubscriptionTier, Integer> words = new EnumMap<>(SubscriptionTier.class);
            words.put(SubscriptionTier.STANDARD, 11);
            words.put(SubscriptionTier.VIP, 11);
            words.put(SubscriptionTier.ROYAL, 7);
            return words;
        }
    }

    /**
     * Free chatting when the platform earns and the other participant is not monetized.
     */
    @Data
    public static class FreePool {
        /**
         * Accounts this many days old or younger never chat for free.
         */
        @Min(0)
        private int minAccountAgeDays = 5;

        /**
         * Free messages for a mid-popularity counterpart. Low popularity chats free without limit.
         */
        @Min(0)
        private int midPopularityMessageLimit = 50;
    }

    @Data
    public static class Call {
        @Positive
        private long voiceMinutePrice = 10L;

        @Positive
        private long videoMinutePrice = 20L;

        /**
         * Discount off the per-minute price, keyed by the payer's tier.
         * The discounted price is rounded up so a minute never becomes free.
         */
        private Map<SubscriptionTier, Integer> discountBps = defaultDiscounts();

        @Min(0)
        @Max(10_000)
        private int earnerRateBps = 8_000;

        private static Map<SubscriptionTier, Integer> defaultDiscounts() {
            Map<SubscriptionTier, Integer> discounts = new EnumMap<>(SubscriptionTier.class);
            discounts.put(SubscriptionTier.STANDARD, 0);
            discounts.put(SubscriptionTier.VIP, 3_000);
            discounts.put(SubscriptionTier.ROYAL, 5_000);
            return discounts;
        }
    }

    @Data
    public static class Booking {
        /**
         * Share of the booking price held for the host; the remainder is the platform fee.
         */
        @Min(0)
        @Max(10_000)
        private int hostShareBps = 8_000;
    }
}
