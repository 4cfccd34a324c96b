package com.flagship.token_wallet.session;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.common.ConcurrencyRetry;
import com.flagship.token_wallet.common.ErrorCode;
import com.flagship.token_wallet.event.SessionChargedEvent;
import com.flagship.token_wallet.event.SessionEndedEvent;
import com.flagship.token_wallet.event.SessionStartedEvent;
import com.flagship.token_wallet.metering.FreeChatAllowance;
import com.flagship.token_wallet.metering.FreeChatPolicy;
import com.flagship.token_wallet.metering.UsageMeter;
import com.flagship.token_wallet.metering.WordCounter;
import com.flagship.token_wallet.observability.BillingMetrics;
import com.flagship.token_wallet.observability.CorrelationContext;
import com.flagship.token_wallet.outbox.OutboxService;
import com.flagship.token_wallet.pricing.PricingRuleStore;
import com.flagship.token_wallet.pricing.RevenueSplit;
import com.flagship.token_wallet.pricing.UnitPrice;
import com.flagship.token_wallet.roles.ParticipantProfile;
import com.flagship.token_wallet.roles.RoleResolution;
import com.flagship.token_wallet.roles.RoleResolver;
import com.flagship.token_wallet.wallet.LedgerProperties;
import com.flagship.token_wallet.wallet.LedgerTransaction;
import com.flagship.token_wallet.wallet.TransactionKind;
import com.flagship.token_wallet.wallet.TransferRequest;
import com.flagship.token_wallet.wallet.Wallet;
import com.flagship.token_wallet.wallet.WalletLedger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Coordinates roles, metering, pricing and the ledger into billing ticks.
 *
 * Every operation on an existing session runs in one transaction that row-locks the
 * session, so ticks for one session are applied one at a time and the ledger legs commit
 * together with the session counters and the outbox events describing them.
 *
 * Lifecycle:
 * <pre>
 * PENDING_START -> ACTIVE -> (tick)* -> ENDED
 *                  ACTIVE -> ABORTED (idle timeout)
 * </pre>
 *
 * Ticks that reach an already finished session are ignored. Explicit operations on one
 * (ending it twice) fail with INVALID_SESSION_STATE.
 */
@Service
@Slf4j
public class BillingOrchestrator {

    public static final String AGGREGATE_TYPE = "BillingSession";

    private final RoleResolver roleResolver;
    private final PricingRuleStore pricingRuleStore;
    private final UsageMeter usageMeter;
    private final FreeChatPolicy freeChatPolicy;
    private final WalletLedger walletLedger;
    private final SessionPersistenceService persistence;
    private final OutboxService outboxService;
    private final BillingMetrics metrics;
    private final ConcurrencyRetry concurrencyRetry;
    private final LedgerProperties ledgerProperties;
    private final SessionProperties sessionProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public BillingOrchestrator(RoleResolver roleResolver,
                               PricingRuleStore pricingRuleStore,
                               UsageMeter usageMeter,
                               FreeChatPolicy freeChatPolicy,
                               WalletLedger walletLedger,
                               SessionPersistenceService persistence,
                               OutboxService outboxService,
                               BillingMetrics metrics,
                               ConcurrencyRetry concurrencyRetry,
                               LedgerProperties ledgerProperties,
                               SessionProperties sessionProperties,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.roleResolver = roleResolver;
        this.pricingRuleStore = pricingRuleStore;
        this.usageMeter = usageMeter;
        this.freeChatPolicy = freeChatPolicy;
        this.walletLedger = walletLedger;
        this.persistence = persistence;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.concurrencyRetry = concurrencyRetry;
        this.ledgerProperties = ledgerProperties;
        this.sessionProperties = sessionProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    // ==================== Session start ====================

    /**
     * Resolves payer and earner, freezes the price and opens the session.
     *
     * The payer must hold at least one unit's price. A session that fails this check is
     * never persisted.
     */
    public BillingResult<SessionHandle> startSession(SessionType sessionType,
                                                     ParticipantProfile participantA,
                                                     ParticipantProfile participantB,
                                                     String initiatorId) {
        if (sessionType == null || participantA == null || participantB == null) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, "Session type and both participants are required");
        }
        RoleResolution roles;
        try {
            roles = roleResolver.resolve(participantA, participantB, sessionType, initiatorId);
        } catch (IllegalArgumentException e) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, e.getMessage());
        }
        ParticipantProfile payer = roles.getPayerId().equals(participantA.getUserId()) ? participantA : participantB;
        UnitPrice price = pricingRuleStore.priceFor(sessionType, payer.getTier());
        FreeChatAllowance freeChat = freeChatPolicy.allowanceFor(sessionType, roles, participantA, participantB);

        UUID sessionId = UUID.randomUUID();
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, sessionId.toString());
        try {
            BillingResult<SessionHandle> result = concurrencyRetry.execute("startSession",
                () -> transactionTemplate.execute(status ->
                    openSession(sessionId, sessionType, participantA, participantB, initiatorId, roles, payer, price, freeChat)));

            if (result.isSuccess()) {
                metrics.recordSessionStarted(sessionType.name());
                log.info("Session started: type={}, payer={}, earner={}, rule={}, unit={}x{} at {}",
                    sessionType, roles.getPayerId(), roles.isPlatformEarner() ? "platform" : roles.getEarnerId(),
                    roles.getRule(), price.getUnitSize(), price.getBillingUnit(), price.getPricePerUnit());
            } else {
                metrics.recordSessionRejected(sessionType.name(), result.getError().getCode().name());
                log.info("Session start rejected: type={}, payer={}, reason={}",
                    sessionType, roles.getPayerId(), result.getError().getCode());
            }
            return result;
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }

    private BillingResult<SessionHandle> openSession(UUID sessionId, SessionType sessionType,
                                                     ParticipantProfile participantA, ParticipantProfile participantB,
                                                     String initiatorId, RoleResolution roles,
                                                     ParticipantProfile payer, UnitPrice price,
                                                     FreeChatAllowance freeChat) {
        BillingResult<Wallet> payerWallet = usableWallet(roles.getPayerId());
        if (payerWallet.isFailure()) {
            return payerWallet.asFailure();
        }
        if (!payerWallet.getValue().canCover(price.getPricePerUnit())) {
            return BillingResult.failure(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Wallet %s cannot cover the first unit (%d)", roles.getPayerId(), price.getPricePerUnit()));
        }
        if (!roles.isPlatformEarner()) {
            BillingResult<Wallet> earnerWallet = usableWallet(roles.getEarnerId());
            if (earnerWallet.isFailure()) {
                return earnerWallet.asFailure();
            }
        }

        Instant now = clock.instant();
        BillingSession session = BillingSession.create(sessionId, sessionType,
                participantA.getUserId(), participantB.getUserId(), initiatorId,
                roles, payer.getTier(), price, freeChat, now)
            .activate(now);
        BillingSession saved = persistence.save(session);
        outboxService.saveEvent(AGGREGATE_TYPE, SessionStartedEvent.from(saved));
        return BillingResult.success(SessionHandle.from(saved));
    }

    private BillingResult<Wallet> usableWallet(String walletId) {
        Optional<Wallet> wallet = walletLedger.getWallet(walletId);
        if (wallet.isEmpty()) {
            return BillingResult.failure(ErrorCode.WALLET_NOT_FOUND, "Wallet not found: " + walletId);
        }
        if (wallet.get().isClosed()) {
            return BillingResult.failure(ErrorCode.WALLET_CLOSED, "Wallet is closed: " + walletId);
        }
        if (wallet.get().isFrozen()) {
            return BillingResult.failure(ErrorCode.WALLET_FROZEN, "Wallet is frozen: " + walletId);
        }
        return BillingResult.success(wallet.get());
    }

    // ==================== Ticks ====================

    /**
     * Adds raw usage (words for chats, elapsed seconds for calls) and bills what is due.
     */
    public BillingResult<TickOutcome> recordUsage(UUID sessionId, long unitsDelta) {
        if (unitsDelta < 0) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, "Usage must not be negative: " + unitsDelta);
        }
        if (unitsDelta > UsageMeter.MAX_USAGE_PER_REPORT) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, String.format(
                "Usage %d exceeds the per-report limit of %d", unitsDelta, UsageMeter.MAX_USAGE_PER_REPORT));
        }
        return tick(sessionId, "recordUsage",
            session -> BillingResult.success(usageMeter.recordActivity(session, unitsDelta, clock.instant())));
    }

    /**
     * Meters one chat message. Only the earner's words are billable; when the platform is
     * the sole earner every message is. Free messages left on the session are used first.
     */
    public BillingResult<TickOutcome> recordMessage(UUID sessionId, String senderId, String text) {
        return tick(sessionId, "recordMessage", session -> {
            if (session.getSessionType() != SessionType.CHAT) {
                return BillingResult.failure(ErrorCode.INVALID_REQUEST,
                    "Messages are only metered on chat sessions, not " + session.getSessionType());
            }
            if (!session.isParticipant(senderId)) {
                return BillingResult.failure(ErrorCode.INVALID_REQUEST,
                    senderId + " is not a participant of session " + sessionId);
            }
            boolean billable = session.getEarnerId() == null || session.getEarnerId().equals(senderId);
            long words = billable ? WordCounter.countBillableWords(text) : 0;
            return BillingResult.success(usageMeter.recordMessage(session, senderId, words, clock.instant()));
        });
    }

    /**
     * Keeps an idle session alive without adding usage.
     */
    public BillingResult<TickOutcome> heartbeat(UUID sessionId) {
        return tick(sessionId, "heartbeat",
            session -> BillingResult.success(session.touch(clock.instant())));
    }

    private BillingResult<TickOutcome> tick(UUID sessionId, String operation,
                                            Function<BillingSession, BillingResult<BillingSession>> accrue) {
        return withSession(sessionId, () -> concurrencyRetry.execute(operation,
            () -> transactionTemplate.execute(status -> {
                Optional<BillingSession> locked = persistence.lockForUpdate(sessionId);
                if (locked.isEmpty()) {
                    return BillingResult.<TickOutcome>failure(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
                }
                BillingSession session = locked.get();
                if (session.isTerminal()) {
                    log.debug("Ignoring {} on {} session", operation, session.getState());
                    return BillingResult.success(TickOutcome.ignored(session));
                }

                BillingResult<BillingSession> accrued = accrue.apply(session);
                if (accrued.isFailure()) {
                    return accrued.<TickOutcome>asFailure();
                }

                BillingResult<Settlement> settled = settle(accrued.getValue());
                if (settled.isFailure()) {
                    // nothing was charged; keep the usage pending for the next tick
                    persistence.update(accrued.getValue());
                    log.warn("Tick on session {} could not be billed: {}", sessionId, settled.getError());
                    return settled.<TickOutcome>asFailure();
                }
                persistence.update(settled.getValue().session());
                return BillingResult.success(settled.getValue().outcome());
            })));
    }

    private record Settlement(BillingSession session, TickOutcome outcome) {
    }

    /**
     * Bills every pending unit. When the payer cannot cover all of them, the units they can
     * cover are billed and the session ends with INSUFFICIENT_FUNDS. A failed result means
     * nothing was written.
     */
    private BillingResult<Settlement> settle(BillingSession session) {
        long due = usageMeter.unitsDue(session);
        if (due == 0) {
            return BillingResult.success(new Settlement(session, TickOutcome.nothingDue(session)));
        }

        BillingResult<BillingSession> charged = charge(session, due);
        if (charged.isSuccess()) {
            BillingSession billed = charged.getValue();
            return BillingResult.success(new Settlement(billed,
                TickOutcome.charged(billed, due, Math.multiplyExact(due, session.getPricePerUnit()))));
        }
        if (!charged.hasError(ErrorCode.INSUFFICIENT_FUNDS)) {
            return charged.asFailure();
        }

        long balance = walletLedger.getWallet(session.getPayerId()).map(Wallet::getBalanceMinor).orElse(0L);
        long affordable = Math.min(due - 1, balance / session.getPricePerUnit());
        BillingSession current = session;
        long amount = 0;
        if (affordable > 0) {
            BillingResult<BillingSession> partial = charge(session, affordable);
            if (partial.isFailure()) {
                return partial.asFailure();
            }
            current = partial.getValue();
            amount = Math.multiplyExact(affordable, session.getPricePerUnit());
        }

        BillingSession ended = current.end(SessionEndReason.INSUFFICIENT_FUNDS, clock.instant());
        outboxService.saveEvent(AGGREGATE_TYPE, SessionEndedEvent.from(ended));
        metrics.recordSessionEnded(ended.getSessionType().name(), SessionEndReason.INSUFFICIENT_FUNDS.name());
        log.info("Session ended for insufficient funds: payer={}, billed {} of {} due units, {} unbilled",
            ended.getPayerId(), affordable, due, ended.getUnitsPending());
        return BillingResult.success(new Settlement(ended, TickOutcome.insufficientFunds(ended, affordable, amount)));
    }

    /**
     * Posts the split charge for the next {@code units} units inside the current transaction.
     */
    private BillingResult<BillingSession> charge(BillingSession session, long units) {
        long fromUnit = session.getUnitsBilled() + 1;
        long toUnit = session.getUnitsBilled() + units;
        long amount = Math.multiplyExact(units, session.getPricePerUnit());
        RevenueSplit split = session.getEarnerId() != null
            ? pricingRuleStore.split(amount, session.getEarnerRateBps())
            : RevenueSplit.platformOnly(amount);

        BillingResult<List<LedgerTransaction>> posted =
            walletLedger.postTransfers(chargeLegs(session, fromUnit, toUnit, split));
        if (posted.isFailure()) {
            return posted.asFailure();
        }

        BillingSession billed = session.recordBilled(units, amount, split.getEarnerShare());
        outboxService.saveEvent(AGGREGATE_TYPE,
            SessionChargedEvent.from(billed, fromUnit, toUnit, split, clock.instant()));
        metrics.recordSessionCharged(session.getSessionType().name(), units, amount);
        log.debug("Charged units {}-{}: amount={}, earner={}, platform={}",
            fromUnit, toUnit, amount, split.getEarnerShare(), split.getPlatformShare());
        return BillingResult.success(billed);
    }

    /**
     * Transaction ids are derived from the session and unit range, so re-running a tick for
     * the same units can never charge twice.
     */
    List<TransferRequest> chargeLegs(BillingSession session, long fromUnit, long toUnit, RevenueSplit split) {
        String prefix = session.getSessionId() + ":" + fromUnit + "-" + toUnit;
        String related = session.getSessionId().toString();
        TransactionKind kind = session.getSessionType().transactionKind();
        List<TransferRequest> legs = new ArrayList<>(2);
        if (split.getEarnerShare() > 0) {
            legs.add(TransferRequest.of(prefix + ":earner", session.getPayerId(), session.getEarnerId(),
                split.getEarnerShare(), kind, related));
        }
        if (split.getPlatformShare() > 0) {
            legs.add(TransferRequest.of(prefix + ":fee", session.getPayerId(), ledgerProperties.getPlatformWalletId(),
                split.getPlatformShare(), session.getEarnerId() != null ? TransactionKind.FEE : kind, related));
        }
        return legs;
    }

    // ==================== Session end ====================

    /**
     * Settles what is still pending and closes the session.
     *
     * If the payer cannot cover the remaining units the session ends with
     * INSUFFICIENT_FUNDS instead of CLOSED and the summary reports the unbilled units.
     */
    public BillingResult<FinalBillingSummary> endSession(UUID sessionId) {
        return withSession(sessionId, () -> concurrencyRetry.execute("endSession",
            () -> transactionTemplate.execute(status -> {
                Optional<BillingSession> locked = persistence.lockForUpdate(sessionId);
                if (locked.isEmpty()) {
                    return BillingResult.<FinalBillingSummary>failure(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
                }
                BillingSession session = locked.get();
                if (session.isTerminal()) {
                    return BillingResult.<FinalBillingSummary>failure(ErrorCode.INVALID_SESSION_STATE,
                        String.format("Session %s is already %s", sessionId, session.getState()));
                }

                BillingResult<Settlement> settled = settle(session);
                if (settled.isFailure()) {
                    return settled.<FinalBillingSummary>asFailure();
                }
                BillingSession finished = settled.getValue().session();
                if (finished.isActive()) {
                    finished = finished.end(SessionEndReason.CLOSED, clock.instant());
                    outboxService.saveEvent(AGGREGATE_TYPE, SessionEndedEvent.from(finished));
                    metrics.recordSessionEnded(finished.getSessionType().name(), SessionEndReason.CLOSED.name());
                }
                BillingSession saved = persistence.update(finished);
                log.info("Session closed: state={}, units={}, amount={}, earner={}",
                    saved.getState(), saved.getUnitsBilled(), saved.getAmountBilledMinor(), saved.getEarnerAmountMinor());
                return BillingResult.success(FinalBillingSummary.from(saved));
            })));
    }

    /**
     * Aborts active sessions whose last activity is older than the idle timeout. Usage
     * reported before the abort is settled; the silent gap is not charged.
     *
     * @return number of sessions aborted
     */
    public int abortIdleSessions(Instant now) {
        int aborted = 0;
        for (SessionType sessionType : SessionType.values()) {
            Instant cutoff = now.minus(sessionProperties.idleTimeoutFor(sessionType));
            List<UUID> candidates = persistence.findIdleSessionIds(sessionType, cutoff,
                sessionProperties.getReaperBatchSize());
            for (UUID sessionId : candidates) {
                BillingResult<Boolean> result = withSession(sessionId, () -> concurrencyRetry.execute("abortIdle",
                    () -> transactionTemplate.execute(status -> abortIfIdle(sessionId, cutoff, now))));
                if (result.isFailure()) {
                    log.warn("Could not abort idle session {}: {}", sessionId, result.getError());
                } else if (result.getValue()) {
                    aborted++;
                }
            }
            if (!candidates.isEmpty()) {
                log.info("Idle {} sessions before {}: {} found", sessionType, cutoff, candidates.size());
            }
        }
        if (aborted > 0) {
            log.info("Aborted {} idle sessions", aborted);
        }
        return aborted;
    }

    private BillingResult<Boolean> abortIfIdle(UUID sessionId, Instant cutoff, Instant now) {
        Optional<BillingSession> locked = persistence.lockForUpdate(sessionId);
        if (locked.isEmpty() || locked.get().isTerminal() || !locked.get().isIdleSince(cutoff)) {
            return BillingResult.success(false);
        }
        BillingSession session = locked.get();
        BillingResult<Settlement> settled = settle(session);
        if (settled.isSuccess()) {
            session = settled.getValue().session();
        } else {
            log.warn("Aborting session {} with {} units unbilled: {}",
                sessionId, session.getUnitsPending(), settled.getError());
        }
        if (session.isActive()) {
            session = session.abort(now);
            outboxService.saveEvent(AGGREGATE_TYPE, SessionEndedEvent.from(session));
            metrics.recordSessionEnded(session.getSessionType().name(), SessionEndReason.IDLE_TIMEOUT.name());
        }
        persistence.update(session);
        return BillingResult.success(true);
    }

    // ==================== Queries ====================

    public Optional<BillingSession> getSession(UUID sessionId) {
        return persistence.findById(sessionId);
    }

    public BillingResult<FinalBillingSummary> getSummary(UUID sessionId) {
        return persistence.findById(sessionId)
            .map(session -> BillingResult.success(FinalBillingSummary.from(session)))
            .orElseGet(() -> BillingResult.failure(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId));
    }

    private <T> BillingResult<T> withSession(UUID sessionId, Supplier<BillingResult<T>> work) {
        if (sessionId == null) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, "Session id is required");
        }
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, sessionId.toString());
        try {
            return work.get();
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
        }
    }
}
