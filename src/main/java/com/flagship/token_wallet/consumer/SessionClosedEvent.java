package com.flagship.token_wallet.consumer;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * The chat or call ended on the client side; billing settles and closes the session.
 */
@Value
@Builder
@Jacksonized
public class SessionClosedEvent {
    public static final String EVENT_TYPE = "SessionClosed";

    UUID eventId;
    UUID sessionId;
    Instant occurredAt;
}
