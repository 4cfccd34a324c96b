package com.flagship.token_wallet.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_wallet.wallet.EntryType;
import com.flagship.token_wallet.wallet.LedgerTransaction;
import com.flagship.token_wallet.wallet.StatementEntry;
import com.flagship.token_wallet.wallet.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A ledger transaction; statement lines also carry the entry side and signed amount.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResponse {

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("from_wallet_id")
    String fromWalletId;

    @JsonProperty("to_wallet_id")
    String toWalletId;

    @JsonProperty("amount_minor")
    long amountMinor;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("related_session_id")
    String relatedSessionId;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("signed_amount_minor")
    Long signedAmountMinor;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return base(transaction).build();
    }

    public static TransactionResponse from(StatementEntry entry) {
        return base(entry.getTransaction())
            .entryType(entry.getEntryType())
            .signedAmountMinor(entry.getSignedAmountMinor())
            .build();
    }

    private static TransactionResponseBuilder base(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .transactionId(transaction.getTransactionId())
            .sequenceNumber(transaction.getSequenceNumber())
            .fromWalletId(transaction.getFromWalletId())
            .toWalletId(transaction.getToWalletId())
            .amountMinor(transaction.getAmountMinor())
            .kind(transaction.getKind())
            .relatedSessionId(transaction.getRelatedSessionId())
            .createdAt(transaction.getCreatedAt());
    }
}
