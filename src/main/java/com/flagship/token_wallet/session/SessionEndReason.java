package com.flagship.token_wallet.session;

public enum SessionEndReason {
    CLOSED,
    INSUFFICIENT_FUNDS,
    IDLE_TIMEOUT
}
