package com.flagship.token_wallet.pricing;

/**
 * Subscription tier of a participant. Drives discounts and chat bucket sizes.
 */
public enum SubscriptionTier {
    STANDARD,
    VIP,
    ROYAL
}
