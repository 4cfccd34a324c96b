package com.flagship.token_wallet.session;

import lombok.Value;

import java.util.UUID;

/**
 * Result of one billing tick.
 *
 * When {@code terminateInteraction} is set the payer ran out of funds and the chat or call
 * must be cut off by the caller.
 */
@Value
public class TickOutcome {
    UUID sessionId;
    Status status;
    long unitsBilled;
    long amountBilledMinor;
    long totalUnitsBilled;
    SessionState sessionState;
    boolean terminateInteraction;

    public enum Status {
        /** Units were charged. */
        CHARGED,
        /** Usage was recorded, nothing is due yet. */
        NOTHING_DUE,
        /** The payer could not cover the due units; coverable units were charged and the session ended. */
        INSUFFICIENT_FUNDS,
        /** The session had already ended; the tick changed nothing. */
        IGNORED
    }

    static TickOutcome charged(BillingSession session, long units, long amountMinor) {
        return new TickOutcome(session.getSessionId(), Status.CHARGED, units, amountMinor,
            session.getUnitsBilled(), session.getState(), false);
    }

    static TickOutcome nothingDue(BillingSession session) {
        return new TickOutcome(session.getSessionId(), Status.NOTHING_DUE, 0, 0,
            session.getUnitsBilled(), session.getState(), false);
    }

    static TickOutcome insufficientFunds(BillingSession session, long units, long amountMinor) {
        return new TickOutcome(session.getSessionId(), Status.INSUFFICIENT_FUNDS, units, amountMinor,
            session.getUnitsBilled(), session.getState(), true);
    }

    static TickOutcome ignored(BillingSession session) {
        return new TickOutcome(session.getSessionId(), Status.IGNORED, 0, 0,
            session.getUnitsBilled(), session.getState(), true);
    }
}
