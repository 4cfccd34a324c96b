package com.flagship.token_wallet.pricing;

/**
 * How raw usage is converted into billable units.
 */
public enum BillingUnit {
    /** Every message adds ceil(words / bucketSize) buckets. */
    WORD_BUCKET,
    /** Billable minutes are ceil(totalSeconds / 60) over the whole session. */
    MINUTE
}
