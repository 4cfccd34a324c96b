package com.flagship.token_wallet.wallet;

import lombok.Value;

/**
 * One leg of a transfer.
 *
 * Invariants: the amount is positive, at least one side is a wallet, and the two sides differ.
 */
@Value
public class TransferRequest {

    /**
     * Largest amount a single leg may carry: ten billion major units at two decimals.
     * Keeps every split and balance computation far from {@code long} overflow.
     */
    public static final long MAX_AMOUNT_MINOR = 1_000_000_000_000L;

    String transactionId;
    String fromWalletId;
    String toWalletId;
    long amountMinor;
    TransactionKind kind;
    String relatedSessionId;

    private TransferRequest(String transactionId, String fromWalletId, String toWalletId,
                            long amountMinor, TransactionKind kind, String relatedSessionId) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new IllegalArgumentException("Transaction id is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Transaction kind is required");
        }
        if (amountMinor <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amountMinor);
        }
        if (amountMinor > MAX_AMOUNT_MINOR) {
            throw new IllegalArgumentException(String.format(
                "Amount %d exceeds the per-transfer limit of %d", amountMinor, MAX_AMOUNT_MINOR));
        }
        if (fromWalletId == null && toWalletId == null) {
            throw new IllegalArgumentException("A transfer needs a source or a destination wallet");
        }
        if (fromWalletId != null && fromWalletId.equals(toWalletId)) {
            throw new IllegalArgumentException("Cannot transfer from a wallet to itself: " + fromWalletId);
        }
        this.transactionId = transactionId;
        this.fromWalletId = fromWalletId;
        this.toWalletId = toWalletId;
        this.amountMinor = amountMinor;
        this.kind = kind;
        this.relatedSessionId = relatedSessionId;
    }

    public static TransferRequest of(String transactionId, String fromWalletId, String toWalletId,
                                     long amountMinor, TransactionKind kind, String relatedSessionId) {
        if (fromWalletId == null || toWalletId == null) {
            throw new IllegalArgumentException("Wallet-to-wallet transfers need both wallets, use mint or burn");
        }
        return new TransferRequest(transactionId, fromWalletId, toWalletId, amountMinor, kind, relatedSessionId);
    }

    public static TransferRequest mint(String transactionId, String toWalletId, long amountMinor, String reference) {
        return new TransferRequest(transactionId, null, toWalletId, amountMinor, TransactionKind.TOP_UP, reference);
    }

    public static TransferRequest burn(String transactionId, String fromWalletId, long amountMinor, String reference) {
        return new TransferRequest(transactionId, fromWalletId, null, amountMinor, TransactionKind.PAYOUT, reference);
    }
}
