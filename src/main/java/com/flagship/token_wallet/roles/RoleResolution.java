package com.flagship.token_wallet.roles;

import lombok.Value;

/**
 * Payer and earner of a session. A null earner means the platform earns everything.
 */
@Value
public class RoleResolution {
    String payerId;
    String earnerId;
    ResolutionRule rule;

    public boolean isPlatformEarner() {
        return earnerId == null;
    }
}
