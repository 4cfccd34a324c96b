package com.flagship.token_wallet.consumer;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * A chat message delivered in a session, published by the chat service.
 */
@Value
@Builder
@Jacksonized
public class MessageSentEvent {
    public static final String EVENT_TYPE = "MessageSent";

    UUID eventId;
    UUID sessionId;
    String senderId;
    String text;
    Instant occurredAt;
}
