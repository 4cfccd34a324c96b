package com.flagship.token_wallet.wallet;

import lombok.Value;

/**
 * Totals used to check that value is neither created nor destroyed inside the ledger:
 * the sum of all balances must equal everything minted minus everything burned.
 */
@Value
public class ConservationReport {
    long totalMintedMinor;
    long totalBurnedMinor;
    long totalBalanceMinor;

    public boolean isBalanced() {
        return totalMintedMinor - totalBurnedMinor == totalBalanceMinor;
    }
}
