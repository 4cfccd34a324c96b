package com.flagship.token_wallet.escrow;

/**
 * HELD is the only non-terminal status.
 */
public enum EscrowStatus {
    HELD,
    RELEASED,
    REFUNDED,
    PARTIALLY_REFUNDED;

    public boolean isTerminal() {
        return this != HELD;
    }
}
