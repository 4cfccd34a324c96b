package com.flagship.token_wallet.pricing;

import lombok.Value;

/**
 * Price of one billable unit for a session, frozen when the session starts.
 */
@Value
public class UnitPrice {
    BillingUnit billingUnit;
    /** Words per bucket, or seconds per minute. */
    int unitSize;
    long pricePerUnit;
    int earnerRateBps;
}
