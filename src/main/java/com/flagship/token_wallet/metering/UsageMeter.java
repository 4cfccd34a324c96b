package com.flagship.token_wallet.metering;

import com.flagship.token_wallet.pricing.PricingRuleStore;
import com.flagship.token_wallet.session.BillingSession;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Turns raw usage into billable units and decides when a session has something to bill.
 *
 * <ul>
 *   <li>Word buckets: each message of {@code w} words adds {@code ceil(w / bucketSize)} units.
 *       A partial bucket is billed as a whole one.</li>
 *   <li>Minutes: usage is elapsed seconds, billable minutes are {@code ceil(totalSeconds / 60)}
 *       over the whole session and pending units are those not yet billed, so a minute is
 *       never billed twice.</li>
 * </ul>
 *
 * Chat messages first draw on the sender's free messages, then on the session's free pool.
 */
@Component
public class UsageMeter {

    /**
     * Largest raw usage one report may add: a billion words, or about 31 years of call time.
     */
    public static final long MAX_USAGE_PER_REPORT = 1_000_000_000L;

    /**
     * Adds {@code units} of raw usage (words of one message, or elapsed seconds) to the session.
     */
    public BillingSession recordActivity(BillingSession session, long units, Instant now) {
        if (units < 0) {
            throw new IllegalArgumentException("Usage must not be negative: " + units);
        }
        if (units > MAX_USAGE_PER_REPORT) {
            throw new IllegalArgumentException("Usage report too large: " + units);
        }
        if (units == 0) {
            return session.touch(now);
        }
        long accrued = Math.addExact(session.getUsageAccrued(), units);
        long pending = switch (session.getBillingUnit()) {
            case WORD_BUCKET -> Math.addExact(session.getUnitsPending(),
                PricingRuleStore.ceilDiv(units, session.getUnitSize()));
            case MINUTE -> PricingRuleStore.ceilDiv(accrued, session.getUnitSize()) - session.getUnitsBilled();
        };
        return session.withUsage(accrued, pending, now);
    }

    /**
     * Records one chat message. {@code billableWords} is zero when the sender's words are not billed.
     */
    public BillingSession recordMessage(BillingSession session, String senderId, long billableWords, Instant now) {
        if (session.hasFreeMessageLeft(senderId)) {
            return session.useFreeMessage(senderId, now);
        }
        if (billableWords > 0 && session.hasFreePoolMessageLeft()) {
            return session.useFreePoolMessage(now);
        }
        return recordActivity(session, billableWords, now);
    }

    public boolean shouldBill(BillingSession session) {
        return unitsDue(session) > 0;
    }

    public long unitsDue(BillingSession session) {
        return Math.max(0L, session.getUnitsPending());
    }
}
