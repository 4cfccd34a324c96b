package com.flagship.token_wallet.consumer;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Raw usage (words or seconds) reported directly in the session's billing unit.
 */
@Value
@Builder
@Jacksonized
public class UsageRecordedEvent {
    public static final String EVENT_TYPE = "UsageRecorded";

    UUID eventId;
    UUID sessionId;
    long units;
    Instant occurredAt;
}
