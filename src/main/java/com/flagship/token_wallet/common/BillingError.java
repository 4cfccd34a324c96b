package com.flagship.token_wallet.common;

import lombok.Value;

/**
 * A typed failure: the error code plus a human readable message.
 */
@Value
public class BillingError {
    ErrorCode code;
    String message;

    public static BillingError of(ErrorCode code, String message) {
        return new BillingError(code, message);
    }
}
