package com.flagship.token_wallet.session;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Session lifecycle settings (billing.sessions.*).
 */
@Configuration
@ConfigurationProperties(prefix = "billing.sessions")
@Validated
@Data
public class SessionProperties {

    /**
     * A session with no activity for this long is aborted by the idle reaper.
     */
    @NotNull
    @Valid
    private IdleTimeout idleTimeout = new IdleTimeout();

    /**
     * Maximum sessions inspected per reaper run.
     */
    @Positive
    private int reaperBatchSize = 100;

    public Duration idleTimeoutFor(SessionType sessionType) {
        return switch (sessionType) {
            case CHAT -> idleTimeout.getChat();
            case VOICE_CALL -> idleTimeout.getVoiceCall();
            case VIDEO_CALL -> idleTimeout.getVideoCall();
        };
    }

    /**
     * Calls drop quickly when nobody reports usage; chats may sit quiet for days.
     */
    @Data
    public static class IdleTimeout {

        @NotNull
        private Duration chat = Duration.ofHours(48);

        @NotNull
        private Duration voiceCall = Duration.ofMinutes(6);

        @NotNull
        private Duration videoCall = Duration.ofMinutes(6);
    }
}
