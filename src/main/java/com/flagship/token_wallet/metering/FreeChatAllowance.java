package com.flagship.token_wallet.metering;

import lombok.Value;

/**
 * Free chat messages granted to a session when it starts.
 *
 * Every participant first gets {@code perParticipant} free messages. When those are used
 * up, a free pool may cover further messages: none, a fixed number, or all of them.
 */
@Value
public class FreeChatAllowance {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    public static final FreeChatAllowance NONE = new FreeChatAllowance(0, 0);

    int perParticipant;
    int poolLimit;

    public FreeChatAllowance(int perParticipant, int poolLimit) {
        if (perParticipant < 0 || poolLimit < 0) {
            throw new IllegalArgumentException(
                String.format("Free message allowances must not be negative: %d/%d", perParticipant, poolLimit));
        }
        this.perParticipant = perParticipant;
        this.poolLimit = poolLimit;
    }

    public boolean isUnlimitedPool() {
        return poolLimit == UNLIMITED;
    }
}
