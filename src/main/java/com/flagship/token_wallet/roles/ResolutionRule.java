package com.flagship.token_wallet.roles;

/**
 * Which rule decided the roles of a session, in priority order.
 */
public enum ResolutionRule {
    EARNER_OVERRIDE,
    ASYMMETRIC_PAIRING,
    INITIATOR_PAYS
}
