package com.flagship.token_wallet.metering;

import com.flagship.token_wallet.pricing.PricingProperties;
import com.flagship.token_wallet.roles.ParticipantProfile;
import com.flagship.token_wallet.roles.RoleResolution;
import com.flagship.token_wallet.session.SessionType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides the free chat messages of a new session.
 *
 * Rules:
 * 1. Calls are never free
 * 2. Each chat participant gets the configured number of free messages
 * 3. When the platform is the earner, the non-paying participant's profile may open a
 *    free pool: low popularity chats free without limit, mid popularity up to a fixed
 *    number of messages. New accounts, restricted users and users who earn never qualify.
 */
@Component
@RequiredArgsConstructor
public class FreeChatPolicy {

    private final PricingProperties pricingProperties;

    public FreeChatAllowance allowanceFor(SessionType sessionType, RoleResolution roles,
                                          ParticipantProfile participantA, ParticipantProfile participantB) {
        if (sessionType != SessionType.CHAT) {
            return FreeChatAllowance.NONE;
        }
        PricingProperties.Chat chat = pricingProperties.getChat();
        ParticipantProfile counterpart = roles.getPayerId().equals(participantA.getUserId()) ? participantB : participantA;
        int poolLimit = roles.isPlatformEarner() ? freePoolLimit(counterpart, chat.getFreePool()) : 0;
        return new FreeChatAllowance(chat.getFreeMessagesPerParticipant(), poolLimit);
    }

    private int freePoolLimit(ParticipantProfile counterpart, PricingProperties.FreePool freePool) {
        if (counterpart.isEarnerEligible()
                || counterpart.isFreePoolRestricted()
                || counterpart.getAccountAgeDays() <= freePool.getMinAccountAgeDays()) {
            return 0;
        }
        return switch (counterpart.getPopularity()) {
            case LOW -> FreeChatAllowance.UNLIMITED;
            case MID -> freePool.getMidPopularityMessageLimit();
            case HIGH -> 0;
        };
    }
}
