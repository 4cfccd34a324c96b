package com.flagship.token_wallet.wallet;

import lombok.Value;

import java.time.Instant;

/**
 * A user's or a system account's token balance.
 *
 * Only {@link WalletLedger} changes the balance, and only through a version compare-and-set.
 */
@Value
public class Wallet {
    String walletId;
    long balanceMinor;
    long version;
    boolean frozen;
    boolean closed;
    Instant createdAt;
    Instant updatedAt;

    public boolean canCover(long amountMinor) {
        return balanceMinor >= amountMinor;
    }
}
