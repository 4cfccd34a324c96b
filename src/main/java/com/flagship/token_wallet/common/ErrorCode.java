package com.flagship.token_wallet.common;

/**
 * Expected, recoverable outcomes of billing operations.
 *
 * These are returned inside a {@link BillingResult}, never thrown.
 */
public enum ErrorCode {
    INSUFFICIENT_FUNDS,
    WALLET_FROZEN,
    WALLET_NOT_FOUND,
    WALLET_CLOSED,
    IDEMPOTENCY_CONFLICT,
    CONCURRENT_MODIFICATION,
    INVALID_SESSION_STATE,
    SESSION_NOT_FOUND,
    ESCROW_NOT_FOUND,
    INVALID_ESCROW_STATE,
    INVALID_REQUEST
}
