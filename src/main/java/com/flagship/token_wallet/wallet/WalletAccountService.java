package com.flagship.token_wallet.wallet;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.common.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Wallet lifecycle: open on registration, freeze for investigation, close on account deletion.
 *
 * None of these operations changes a balance. Flag changes bump the wallet version so a
 * transfer that read the wallet before the change loses its compare-and-set.
 */
@Service
@Slf4j
public class WalletAccountService {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public WalletAccountService(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Opens an empty wallet. Opening an existing wallet returns it unchanged.
     */
    @Transactional
    public Wallet openWallet(String walletId) {
        if (walletId == null || walletId.isBlank()) {
            throw new IllegalArgumentException("Wallet id is required");
        }
        Optional<Wallet> existing = find(walletId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Timestamp now = Timestamp.from(clock.instant());
        int inserted = jdbcTemplate.update(
            "INSERT INTO wallets (wallet_id, balance_minor, version, frozen, closed, created_at, updated_at) " +
            "VALUES (?, 0, 0, FALSE, FALSE, ?, ?) ON CONFLICT DO NOTHING",
            walletId, now, now);
        if (inserted > 0) {
            log.info("Opened wallet {}", walletId);
        } else {
            log.debug("Wallet {} was opened concurrently", walletId);
        }
        return find(walletId)
            .orElseThrow(() -> new IllegalStateException("Wallet not readable after insert: " + walletId));
    }

    @Transactional
    public BillingResult<Wallet> freeze(String walletId) {
        return setFrozen(walletId, true);
    }

    @Transactional
    public BillingResult<Wallet> unfreeze(String walletId) {
        return setFrozen(walletId, false);
    }

    /**
     * Closes a wallet. Only an empty wallet can be closed; the row is kept for the ledger history.
     */
    @Transactional
    public BillingResult<Wallet> closeWallet(String walletId) {
        Optional<Wallet> wallet = lock(walletId);
        if (wallet.isEmpty()) {
            return BillingResult.failure(ErrorCode.WALLET_NOT_FOUND, "Wallet not found: " + walletId);
        }
        if (wallet.get().isClosed()) {
            return BillingResult.success(wallet.get());
        }
        if (wallet.get().getBalanceMinor() != 0) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, String.format(
                "Wallet %s still holds %d and cannot be closed", walletId, wallet.get().getBalanceMinor()));
        }
        update("UPDATE wallets SET closed = TRUE, version = version + 1, updated_at = ? WHERE wallet_id = ?", walletId);
        log.info("Closed wallet {}", walletId);
        return BillingResult.success(find(walletId).orElseThrow());
    }

    private BillingResult<Wallet> setFrozen(String walletId, boolean frozen) {
        Optional<Wallet> wallet = lock(walletId);
        if (wallet.isEmpty()) {
            return BillingResult.failure(ErrorCode.WALLET_NOT_FOUND, "Wallet not found: " + walletId);
        }
        if (wallet.get().isClosed()) {
            return BillingResult.failure(ErrorCode.WALLET_CLOSED, "Wallet is closed: " + walletId);
        }
        if (wallet.get().isFrozen() == frozen) {
            return BillingResult.success(wallet.get());
        }
        update("UPDATE wallets SET frozen = " + (frozen ? "TRUE" : "FALSE")
            + ", version = version + 1, updated_at = ? WHERE wallet_id = ?", walletId);
        log.info("Wallet {} {}", walletId, frozen ? "frozen" : "unfrozen");
        return BillingResult.success(find(walletId).orElseThrow());
    }

    private void update(String sql, String walletId) {
        Instant now = clock.instant();
        jdbcTemplate.update(sql, Timestamp.from(now), walletId);
    }

    private Optional<Wallet> lock(String walletId) {
        return jdbcTemplate.query(
            "SELECT wallet_id, balance_minor, version, frozen, closed, created_at, updated_at " +
            "FROM wallets WHERE wallet_id = ? FOR UPDATE",
            WalletLedger.walletRowMapper(),
            walletId).stream().findFirst();
    }

    private Optional<Wallet> find(String walletId) {
        return jdbcTemplate.query(
            "SELECT wallet_id, balance_minor, version, frozen, closed, created_at, updated_at " +
            "FROM wallets WHERE wallet_id = ?",
            WalletLedger.walletRowMapper(),
            walletId).stream().findFirst();
    }
}
