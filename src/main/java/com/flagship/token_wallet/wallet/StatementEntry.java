package com.flagship.token_wallet.wallet;

import lombok.Value;

/**
 * A ledger transaction seen from one wallet: debit or credit, and the signed balance change.
 */
@Value
public class StatementEntry {
    LedgerTransaction transaction;
    EntryType entryType;
    long signedAmountMinor;

    static StatementEntry forWallet(String walletId, LedgerTransaction transaction) {
        boolean debit = walletId.equals(transaction.getFromWalletId());
        return new StatementEntry(
            transaction,
            debit ? EntryType.DEBIT : EntryType.CREDIT,
            debit ? -transaction.getAmountMinor() : transaction.getAmountMinor());
    }
}
