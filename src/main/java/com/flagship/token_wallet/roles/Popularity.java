package com.flagship.token_wallet.roles;

/**
 * Popularity band of a participant, supplied by the caller. Drives free-pool chat eligibility.
 */
public enum Popularity {
    LOW,
    MID,
    HIGH
}
