package com.flagship.token_wallet.wallet;

/**
 * Side of a transaction as seen from one wallet's statement.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
