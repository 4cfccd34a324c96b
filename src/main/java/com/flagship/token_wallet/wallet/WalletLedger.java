package com.flagship.token_wallet.wallet;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.common.ConcurrencyRetry;
import com.flagship.token_wallet.common.ErrorCode;
import com.flagship.token_wallet.observability.BillingMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The only component that moves value between wallets.
 *
 * This service enforces the core invariants:
 * 1. Every leg of a transfer is applied, or none is
 * 2. A transaction id is applied at most once; replays return the original record
 * 3. No wallet balance ever goes negative
 * 4. Ledger transactions are append-only
 *
 * Per-wallet net changes are validated before anything is written, so a failed result never
 * leaves a partial effect. Wallet rows are locked in id order and then updated with a version
 * compare-and-set; losing a race surfaces as an optimistic locking failure that
 * {@link ConcurrencyRetry} turns into a fresh attempt.
 *
 * JDBC is used directly on this path to keep the compare-and-set explicit.
 */
@Service
@Slf4j
public class WalletLedger {

    private static final String WALLET_COLUMNS =
        "wallet_id, balance_minor, version, frozen, closed, created_at, updated_at";
    private static final String TRANSACTION_COLUMNS =
        "transaction_id, sequence_number, from_wallet_id, to_wallet_id, amount_minor, kind, related_session_id, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ConcurrencyRetry concurrencyRetry;
    private final TransferReplayCache replayCache;
    private final BillingMetrics metrics;
    private final Clock clock;

    public WalletLedger(JdbcTemplate jdbcTemplate,
                        PlatformTransactionManager transactionManager,
                        ConcurrencyRetry concurrencyRetry,
                        TransferReplayCache replayCache,
                        BillingMetrics metrics,
                        Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.concurrencyRetry = concurrencyRetry;
        this.replayCache = replayCache;
        this.metrics = metrics;
        this.clock = clock;
    }

    public BillingResult<LedgerTransaction> transfer(String transactionId, String fromWalletId, String toWalletId,
                                                     long amountMinor, TransactionKind kind, String relatedSessionId) {
        return transfer(TransferRequest.of(transactionId, fromWalletId, toWalletId, amountMinor, kind, relatedSessionId));
    }

    /**
     * Moves value along a single leg. Replaying the same id with the same parameters returns
     * the original transaction; with different parameters it fails with IDEMPOTENCY_CONFLICT.
     */
    public BillingResult<LedgerTransaction> transfer(TransferRequest request) {
        Optional<LedgerTransaction> cached = replayCache.find(request.getTransactionId());
        if (cached.isPresent()) {
            if (cached.get().hasSameParameters(request)) {
                metrics.recordIdempotencyHit();
                return BillingResult.success(cached.get());
            }
            return conflict(request);
        }
        return transferAll(List.of(request)).map(transactions -> transactions.get(0));
    }

    /**
     * Applies several legs in one database transaction, all-or-nothing.
     * Used for split charges (payer to earner plus payer to platform).
     */
    public BillingResult<List<LedgerTransaction>> transferAll(List<TransferRequest> requests) {
        long startTime = System.currentTimeMillis();
        BillingResult<List<LedgerTransaction>> result = concurrencyRetry.execute("transfer",
            () -> transactionTemplate.execute(status -> applyTransfers(requests)));

        metrics.recordTransfer(requests.get(0).getKind().name(),
            result.isSuccess() ? "success" : result.getError().getCode().name());
        metrics.recordLedgerLatency("transfer", System.currentTimeMillis() - startTime);
        if (result.isFailure()) {
            log.info("Transfer {} rejected: {} {}", requests.get(0).getTransactionId(),
                result.getError().getCode(), result.getError().getMessage());
        }
        return result;
    }

    /**
     * Applies the legs inside the caller's transaction, so the caller's own state changes
     * (session counters, escrow status) commit or roll back together with the money.
     *
     * IMPORTANT: must be called within an existing transaction. A failed result means nothing
     * was written; conflicts are thrown and roll the caller's transaction back.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public BillingResult<List<LedgerTransaction>> postTransfers(List<TransferRequest> requests) {
        return applyTransfers(requests);
    }

    public BillingResult<LedgerTransaction> mint(String transactionId, String walletId, long amountMinor, String reference) {
        return transfer(TransferRequest.mint(transactionId, walletId, amountMinor, reference));
    }

    public BillingResult<LedgerTransaction> burn(String transactionId, String walletId, long amountMinor, String reference) {
        return transfer(TransferRequest.burn(transactionId, walletId, amountMinor, reference));
    }

    private BillingResult<List<LedgerTransaction>> applyTransfers(List<TransferRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("At least one transfer leg is required");
        }
        Set<String> ids = new HashSet<>();
        for (TransferRequest request : requests) {
            if (!ids.add(request.getTransactionId())) {
                throw new IllegalArgumentException("Duplicate transaction id in one transfer: " + request.getTransactionId());
            }
        }

        Map<String, LedgerTransaction> recorded = new LinkedHashMap<>();
        List<TransferRequest> pending = new ArrayList<>();
        for (TransferRequest request : requests) {
            Optional<LedgerTransaction> existing = findTransaction(request.getTransactionId());
            if (existing.isPresent()) {
                if (!existing.get().hasSameParameters(request)) {
                    return conflict(request);
                }
                recorded.put(request.getTransactionId(), existing.get());
            } else {
                pending.add(request);
            }
        }

        if (pending.isEmpty()) {
            metrics.recordIdempotencyHit();
            log.debug("All {} legs already applied, returning recorded transactions", requests.size());
            return BillingResult.success(inRequestOrder(requests, recorded));
        }
        metrics.recordIdempotencyMiss();

        // Net change per wallet, in id order so concurrent transfers lock rows in the same order
        Map<String, Long> deltas = new TreeMap<>();
        for (TransferRequest request : pending) {
            if (request.getFromWalletId() != null) {
                deltas.merge(request.getFromWalletId(), -request.getAmountMinor(), Math::addExact);
            }
            if (request.getToWalletId() != null) {
                deltas.merge(request.getToWalletId(), request.getAmountMinor(), Math::addExact);
            }
        }

        Map<String, Wallet> wallets = new LinkedHashMap<>();
        for (String walletId : deltas.keySet()) {
            Optional<Wallet> wallet = lockWallet(walletId);
            if (wallet.isEmpty()) {
                return BillingResult.failure(ErrorCode.WALLET_NOT_FOUND, "Wallet not found: " + walletId);
            }
            if (wallet.get().isClosed()) {
                return BillingResult.failure(ErrorCode.WALLET_CLOSED, "Wallet is closed: " + walletId);
            }
            if (wallet.get().isFrozen()) {
                return BillingResult.failure(ErrorCode.WALLET_FROZEN, "Wallet is frozen: " + walletId);
            }
            wallets.put(walletId, wallet.get());
        }

        for (Map.Entry<String, Long> delta : deltas.entrySet()) {
            Wallet wallet = wallets.get(delta.getKey());
            if (wallet.getBalanceMinor() + delta.getValue() < 0) {
                return BillingResult.failure(ErrorCode.INSUFFICIENT_FUNDS, String.format(
                    "Wallet %s holds %d but the transfer needs %d",
                    wallet.getWalletId(), wallet.getBalanceMinor(), -delta.getValue()));
            }
            if (delta.getValue() > 0 && wallet.getBalanceMinor() > Long.MAX_VALUE - delta.getValue()) {
                return BillingResult.failure(ErrorCode.INVALID_REQUEST, String.format(
                    "Crediting %d would overflow the balance of wallet %s", delta.getValue(), wallet.getWalletId()));
            }
        }

        Instant now = clock.instant();
        for (Map.Entry<String, Long> delta : deltas.entrySet()) {
            if (delta.getValue() != 0) {
                compareAndSetBalance(wallets.get(delta.getKey()), delta.getValue(), now);
            }
        }

        List<LedgerTransaction> created = new ArrayList<>();
        for (TransferRequest request : pending) {
            insertTransaction(request, now);
            LedgerTransaction transaction = findTransaction(request.getTransactionId())
                .orElseThrow(() -> new IllegalStateException("Inserted transaction not readable: " + request.getTransactionId()));
            recorded.put(request.getTransactionId(), transaction);
            created.add(transaction);
        }
        replayCache.storeAfterCommit(created);

        log.debug("Applied {} transfer legs touching {} wallets", pending.size(), deltas.size());
        return BillingResult.success(inRequestOrder(requests, recorded));
    }

    private void compareAndSetBalance(Wallet wallet, long delta, Instant now) {
        int updated = jdbcTemplate.update(
            "UPDATE wallets SET balance_minor = ?, version = version + 1, updated_at = ? " +
            "WHERE wallet_id = ? AND version = ?",
            Math.addExact(wallet.getBalanceMinor(), delta),
            Timestamp.from(now),
            wallet.getWalletId(),
            wallet.getVersion());
        if (updated == 0) {
            throw new OptimisticLockingFailureException(String.format(
                "Wallet %s changed after version %d was read", wallet.getWalletId(), wallet.getVersion()));
        }
    }

    private void insertTransaction(TransferRequest request, Instant now) {
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions " +
            "(transaction_id, from_wallet_id, to_wallet_id, amount_minor, kind, related_session_id, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            request.getTransactionId(),
            request.getFromWalletId(),
            request.getToWalletId(),
            request.getAmountMinor(),
            request.getKind().name(),
            request.getRelatedSessionId(),
            Timestamp.from(now));
    }

    private static <T> BillingResult<T> conflict(TransferRequest request) {
        return BillingResult.failure(ErrorCode.IDEMPOTENCY_CONFLICT, String.format(
            "Transaction id %s was already used with different parameters", request.getTransactionId()));
    }

    private List<LedgerTransaction> inRequestOrder(List<TransferRequest> requests, Map<String, LedgerTransaction> recorded) {
        return requests.stream()
            .map(request -> recorded.get(request.getTransactionId()))
            .toList();
    }

    private Optional<Wallet> lockWallet(String walletId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE wallet_id = ? FOR UPDATE",
            walletRowMapper(),
            walletId).stream().findFirst();
    }

    // ==================== Queries ====================

    public Optional<Wallet> getWallet(String walletId) {
        return jdbcTemplate.query(
            "SELECT " + WALLET_COLUMNS + " FROM wallets WHERE wallet_id = ?",
            walletRowMapper(),
            walletId).stream().findFirst();
    }

    public Optional<LedgerTransaction> findTransaction(String transactionId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions WHERE transaction_id = ?",
            transactionRowMapper(),
            transactionId).stream().findFirst();
    }

    /**
     * Statement of a wallet in application order.
     */
    public List<StatementEntry> getHistory(String walletId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions " +
            "WHERE from_wallet_id = ? OR to_wallet_id = ? ORDER BY sequence_number",
            transactionRowMapper(),
            walletId, walletId).stream()
            .map(transaction -> StatementEntry.forWallet(walletId, transaction))
            .toList();
    }

    /**
     * All transactions tied to a session or booking, in application order.
     */
    public List<LedgerTransaction> getSessionTransactions(String relatedSessionId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM ledger_transactions " +
            "WHERE related_session_id = ? ORDER BY sequence_number",
            transactionRowMapper(),
            relatedSessionId);
    }

    /**
     * Reads minted, burned and held totals from one snapshot.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ConservationReport checkConservation() {
        Long minted = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount_minor), 0) FROM ledger_transactions WHERE from_wallet_id IS NULL", Long.class);
        Long burned = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount_minor), 0) FROM ledger_transactions WHERE to_wallet_id IS NULL", Long.class);
        Long balances = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(balance_minor), 0) FROM wallets", Long.class);
        ConservationReport report = new ConservationReport(
            minted != null ? minted : 0L,
            burned != null ? burned : 0L,
            balances != null ? balances : 0L);
        if (!report.isBalanced()) {
            log.error("Ledger conservation violated: minted={}, burned={}, balances={}",
                report.getTotalMintedMinor(), report.getTotalBurnedMinor(), report.getTotalBalanceMinor());
        }
        return report;
    }

    static RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            rs.getString("wallet_id"),
            rs.getLong("balance_minor"),
            rs.getLong("version"),
            rs.getBoolean("frozen"),
            rs.getBoolean("closed"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"));
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> LedgerTransaction.builder()
            .transactionId(rs.getString("transaction_id"))
            .sequenceNumber(rs.getLong("sequence_number"))
            .fromWalletId(rs.getString("from_wallet_id"))
            .toWalletId(rs.getString("to_wallet_id"))
            .amountMinor(rs.getLong("amount_minor"))
            .kind(TransactionKind.valueOf(rs.getString("kind")))
            .relatedSessionId(rs.getString("related_session_id"))
            .createdAt(instant(rs, "created_at"))
            .build();
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
