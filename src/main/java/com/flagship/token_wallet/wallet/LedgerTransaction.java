package com.flagship.token_wallet.wallet;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Objects;

/**
 * An immutable, committed movement of value between two wallets.
 *
 * A null source means the tokens were minted, a null destination means they were burned.
 * The transaction id is the idempotency key.
 */
@Value
@Builder
@Jacksonized
public class LedgerTransaction {
    String transactionId;
    Long sequenceNumber;
    String fromWalletId;
    String toWalletId;
    long amountMinor;
    TransactionKind kind;
    String relatedSessionId;
    Instant createdAt;

    /**
     * True when replaying {@code request} would describe exactly this transaction.
     */
    public boolean hasSameParameters(TransferRequest request) {
        return Objects.equals(fromWalletId, request.getFromWalletId())
            && Objects.equals(toWalletId, request.getToWalletId())
            && amountMinor == request.getAmountMinor()
            && kind == request.getKind()
            && Objects.equals(relatedSessionId, request.getRelatedSessionId());
    }
}
