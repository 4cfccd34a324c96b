package com.flagship.token_wallet.session;

/**
 * Billing session lifecycle.
 *
 * Valid transitions:
 * - PENDING_START -> ACTIVE (payer can cover one unit)
 * - ACTIVE -> ENDED (closed by a participant, or the payer ran out of funds)
 * - ACTIVE -> ABORTED (idle timeout)
 *
 * ENDED and ABORTED are terminal.
 */
public enum SessionState {
    PENDING_START,
    ACTIVE,
    ENDED,
    ABORTED
}
