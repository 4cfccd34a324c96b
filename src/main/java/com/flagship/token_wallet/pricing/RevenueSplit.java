package com.flagship.token_wallet.pricing;

import lombok.Value;

/**
 * A charge divided between the earner and the platform.
 *
 * The earner share is rounded down and the platform receives the remainder, so the two
 * parts always add up to the charged amount.
 */
@Value
public class RevenueSplit {
    long amount;
    long earnerShare;
    long platformShare;

    public static RevenueSplit of(long amount, int earnerRateBps) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
        if (earnerRateBps < 0 || earnerRateBps > PricingRuleStore.BASIS_POINTS) {
            throw new IllegalArgumentException("Earner rate out of range: " + earnerRateBps);
        }
        // floor(amount * rate / 10000) without forming the full product
        long wholeBlocks = amount / PricingRuleStore.BASIS_POINTS;
        long remainder = amount % PricingRuleStore.BASIS_POINTS;
        long earnerShare = wholeBlocks * earnerRateBps + remainder * earnerRateBps / PricingRuleStore.BASIS_POINTS;
        return new RevenueSplit(amount, earnerShare, amount - earnerShare);
    }

    /**
     * Whole amount to the platform, used when no participant earns.
     */
    public static RevenueSplit platformOnly(long amount) {
        return of(amount, 0);
    }
}
