package com.flagship.token_wallet.consumer;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Periodic signal from the call service that a call is still connected.
 * {@code elapsedSeconds} is the talk time since the previous heartbeat.
 */
@Value
@Builder
@Jacksonized
public class CallHeartbeatEvent {
    public static final String EVENT_TYPE = "CallHeartbeat";

    UUID eventId;
    UUID sessionId;
    long elapsedSeconds;
    Instant occurredAt;
}
