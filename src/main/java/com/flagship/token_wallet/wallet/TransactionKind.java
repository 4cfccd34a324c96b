package com.flagship.token_wallet.wallet;

/**
 * Business purpose of a ledger transaction.
 */
public enum TransactionKind {
    CHAT,
    CALL,
    BOOKING,
    REFUND,
    FEE,
    /** Tokens minted into a wallet after an external purchase. */
    TOP_UP,
    /** Tokens burned out of a wallet for an external payout. */
    PAYOUT
}
