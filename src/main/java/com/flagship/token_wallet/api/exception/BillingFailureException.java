package com.flagship.token_wallet.api.exception;

import com.flagship.token_wallet.common.BillingError;
import com.flagship.token_wallet.common.BillingResult;
import lombok.Getter;

/**
 * Carries a typed billing failure from a controller to {@link GlobalExceptionHandler}.
 * Only the REST layer throws it; services return {@link BillingResult}.
 */
@Getter
public class BillingFailureException extends RuntimeException {

    private final BillingError error;

    public BillingFailureException(BillingError error) {
        super(error.getMessage());
        this.error = error;
    }

    public static <T> T unwrap(BillingResult<T> result) {
        if (result.isFailure()) {
            throw new BillingFailureException(result.getError());
        }
        return result.getValue();
    }
}
