package com.flagship.token_wallet.session;

import com.flagship.token_wallet.pricing.BillingUnit;
import com.flagship.token_wallet.wallet.TransactionKind;

/**
 * Kind of paid interaction.
 */
public enum SessionType {
    CHAT(BillingUnit.WORD_BUCKET, TransactionKind.CHAT),
    VOICE_CALL(BillingUnit.MINUTE, TransactionKind.CALL),
    VIDEO_CALL(BillingUnit.MINUTE, TransactionKind.CALL);

    private final BillingUnit billingUnit;
    private final TransactionKind transactionKind;

    SessionType(BillingUnit billingUnit, TransactionKind transactionKind) {
        this.billingUnit = billingUnit;
        this.transactionKind = transactionKind;
    }

    public BillingUnit billingUnit() {
        return billingUnit;
    }

    public TransactionKind transactionKind() {
        return transactionKind;
    }
}
