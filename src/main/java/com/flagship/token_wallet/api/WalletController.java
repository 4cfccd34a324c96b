package com.flagship.token_wallet.api;

import com.flagship.token_wallet.api.dto.AmountRequest;
import com.flagship.token_wallet.api.dto.OpenWalletRequest;
import com.flagship.token_wallet.api.dto.TransactionResponse;
import com.flagship.token_wallet.api.dto.WalletResponse;
import com.flagship.token_wallet.api.exception.BillingFailureException;
import com.flagship.token_wallet.common.BillingError;
import com.flagship.token_wallet.common.ErrorCode;
import com.flagship.token_wallet.observability.CorrelationContext;
import com.flagship.token_wallet.wallet.ConservationReport;
import com.flagship.token_wallet.wallet.LedgerTransaction;
import com.flagship.token_wallet.wallet.TransferRequest;
import com.flagship.token_wallet.wallet.Wallet;
import com.flagship.token_wallet.wallet.WalletAccountService;
import com.flagship.token_wallet.wallet.WalletLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for wallets: lifecycle, statements, top-ups and payouts.
 *
 * Top-ups and payouts are keyed by the caller's transaction id, so a retried request
 * returns the original transaction instead of moving tokens twice.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final WalletAccountService accountService;
    private final WalletLedger ledger;

    @PostMapping("/api/wallets")
    public ResponseEntity<WalletResponse> openWallet(@Valid @RequestBody OpenWalletRequest request) {
        Wallet wallet = accountService.openWallet(request.getWalletId());
        return ResponseEntity.status(HttpStatus.CREATED).body(WalletResponse.from(wallet));
    }

    @GetMapping("/api/wallets/{walletId}")
    public ResponseEntity<WalletResponse> getWallet(@PathVariable("walletId") String walletId) {
        return ledger.getWallet(walletId)
            .map(wallet -> ResponseEntity.ok(WalletResponse.from(wallet)))
            .orElseThrow(() -> notFound(walletId));
    }

    /**
     * Statement of a wallet, oldest first.
     */
    @GetMapping("/api/wallets/{walletId}/transactions")
    public ResponseEntity<List<TransactionResponse>> getTransactions(@PathVariable("walletId") String walletId) {
        if (ledger.getWallet(walletId).isEmpty()) {
            throw notFound(walletId);
        }
        List<TransactionResponse> statement = ledger.getHistory(walletId).stream()
            .map(TransactionResponse::from)
            .toList();
        return ResponseEntity.ok(statement);
    }

    @PostMapping("/api/wallets/{walletId}/top-ups")
    public ResponseEntity<TransactionResponse> topUp(@PathVariable("walletId") String walletId,
                                                     @Valid @RequestBody AmountRequest request) {
        MDC.put(CorrelationContext.WALLET_ID_MDC_KEY, walletId);
        try {
            log.info("Top-up requested: transactionId={}, amount={}", request.getTransactionId(), request.getAmountMinor());
            LedgerTransaction transaction = BillingFailureException.unwrap(ledger.transfer(TransferRequest.mint(
                request.getTransactionId(), walletId, request.getAmountMinor(), request.getReference())));
            return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
        } finally {
            MDC.remove(CorrelationContext.WALLET_ID_MDC_KEY);
        }
    }

    @PostMapping("/api/wallets/{walletId}/payouts")
    public ResponseEntity<TransactionResponse> payout(@PathVariable("walletId") String walletId,
                                                      @Valid @RequestBody AmountRequest request) {
        MDC.put(CorrelationContext.WALLET_ID_MDC_KEY, walletId);
        try {
            log.info("Payout requested: transactionId={}, amount={}", request.getTransactionId(), request.getAmountMinor());
            LedgerTransaction transaction = BillingFailureException.unwrap(ledger.transfer(TransferRequest.burn(
                request.getTransactionId(), walletId, request.getAmountMinor(), request.getReference())));
            return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
        } finally {
            MDC.remove(CorrelationContext.WALLET_ID_MDC_KEY);
        }
    }

    @PostMapping("/api/wallets/{walletId}/freeze")
    public ResponseEntity<WalletResponse> freeze(@PathVariable("walletId") String walletId) {
        return ResponseEntity.ok(WalletResponse.from(BillingFailureException.unwrap(accountService.freeze(walletId))));
    }

    @PostMapping("/api/wallets/{walletId}/unfreeze")
    public ResponseEntity<WalletResponse> unfreeze(@PathVariable("walletId") String walletId) {
        return ResponseEntity.ok(WalletResponse.from(BillingFailureException.unwrap(accountService.unfreeze(walletId))));
    }

    @PostMapping("/api/wallets/{walletId}/close")
    public ResponseEntity<WalletResponse> close(@PathVariable("walletId") String walletId) {
        return ResponseEntity.ok(WalletResponse.from(BillingFailureException.unwrap(accountService.closeWallet(walletId))));
    }

    /**
     * Minted minus burned against the sum of all balances, for reconciliation jobs.
     */
    @GetMapping("/api/ledger/conservation")
    public ResponseEntity<ConservationReport> conservation() {
        return ResponseEntity.ok(ledger.checkConservation());
    }

    private static BillingFailureException notFound(String walletId) {
        return new BillingFailureException(BillingError.of(ErrorCode.WALLET_NOT_FOUND, "Wallet not found: " + walletId));
    }
}
