package com.flagship.token_wallet.escrow;

import com.flagship.token_wallet.common.BillingResult;
import com.flagship.token_wallet.common.ConcurrencyRetry;
import com.flagship.token_wallet.common.ErrorCode;
import com.flagship.token_wallet.event.EscrowHeldEvent;
import com.flagship.token_wallet.event.EscrowResolvedEvent;
import com.flagship.token_wallet.observability.BillingMetrics;
import com.flagship.token_wallet.observability.CorrelationContext;
import com.flagship.token_wallet.outbox.OutboxService;
import com.flagship.token_wallet.pricing.PricingRuleStore;
import com.flagship.token_wallet.pricing.RevenueSplit;
import com.flagship.token_wallet.wallet.LedgerProperties;
import com.flagship.token_wallet.wallet.LedgerTransaction;
import com.flagship.token_wallet.wallet.TransactionKind;
import com.flagship.token_wallet.wallet.TransferRequest;
import com.flagship.token_wallet.wallet.WalletLedger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Holds booking payments in the platform escrow wallet until the booking is resolved.
 *
 * Placing a hold moves the gross price from the payer to the escrow wallet and the
 * platform fee straight on to the platform wallet, in one transaction. Resolution moves
 * the held remainder to the earner, back to the payer, or splits it. Every ledger leg
 * is keyed by the escrow id, and the escrow row is locked while it is resolved, so
 * replays and concurrent resolutions cannot move the money twice.
 */
@Service
@Slf4j
public class EscrowManager {

    public static final String AGGREGATE_TYPE = "Escrow";

    private final EscrowRepository repository;
    private final WalletLedger walletLedger;
    private final PricingRuleStore pricingRuleStore;
    private final CancellationRefundPolicy refundPolicy;
    private final OutboxService outboxService;
    private final BillingMetrics metrics;
    private final ConcurrencyRetry concurrencyRetry;
    private final LedgerProperties ledgerProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public EscrowManager(EscrowRepository repository,
                         WalletLedger walletLedger,
                         PricingRuleStore pricingRuleStore,
                         CancellationRefundPolicy refundPolicy,
                         OutboxService outboxService,
                         BillingMetrics metrics,
                         ConcurrencyRetry concurrencyRetry,
                         LedgerProperties ledgerProperties,
                         PlatformTransactionManager transactionManager,
                         Clock clock) {
        this.repository = repository;
        this.walletLedger = walletLedger;
        this.pricingRuleStore = pricingRuleStore;
        this.refundPolicy = refundPolicy;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.concurrencyRetry = concurrencyRetry;
        this.ledgerProperties = ledgerProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Creates a booking with a fresh booking id and holds its price.
     */
    public BillingResult<EscrowRecord> createBooking(String payerId, String earnerId, long grossAmountMinor) {
        return hold(UUID.randomUUID().toString(), payerId, earnerId, grossAmountMinor);
    }

    /**
     * Holds the booking price. Holding the same booking again with the same parameters
     * returns the existing escrow; with different ones it is an IDEMPOTENCY_CONFLICT.
     */
    public BillingResult<EscrowRecord> hold(String bookingId, String payerId, String earnerId, long grossAmountMinor) {
        if (bookingId == null || bookingId.isBlank() || payerId == null || earnerId == null) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, "Booking id, payer and earner are required");
        }
        if (payerId.equals(earnerId)) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, "Payer and earner must differ");
        }
        if (grossAmountMinor <= 0) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, "Booking amount must be positive: " + grossAmountMinor);
        }
        if (grossAmountMinor > TransferRequest.MAX_AMOUNT_MINOR) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, String.format(
                "Booking amount %d exceeds the limit of %d", grossAmountMinor, TransferRequest.MAX_AMOUNT_MINOR));
        }

        Optional<EscrowRecord> existing = findByBooking(bookingId);
        if (existing.isPresent()) {
            return replayedHold(existing.get(), payerId, earnerId, grossAmountMinor);
        }

        UUID escrowId = UUID.randomUUID();
        MDC.put(CorrelationContext.ESCROW_ID_MDC_KEY, escrowId.toString());
        try {
            BillingResult<EscrowRecord> result = concurrencyRetry.execute("escrowHold",
                () -> transactionTemplate.execute(status ->
                    placeHold(escrowId, bookingId, payerId, earnerId, grossAmountMinor)));
            if (result.isSuccess()) {
                metrics.recordEscrowHeld(grossAmountMinor);
                log.info("Escrow held: booking={}, payer={}, earner={}, gross={}, fee={}, held={}",
                    bookingId, payerId, earnerId, grossAmountMinor,
                    result.getValue().getFeeAmountMinor(), result.getValue().getHeldAmountMinor());
            }
            return result;
        } catch (DataIntegrityViolationException e) {
            // a concurrent hold for the same booking won the unique constraint
            log.info("Concurrent hold for booking {} detected, returning the stored escrow", bookingId);
            return findByBooking(bookingId)
                .map(stored -> replayedHold(stored, payerId, earnerId, grossAmountMinor))
                .orElseThrow(() -> e);
        } finally {
            MDC.remove(CorrelationContext.ESCROW_ID_MDC_KEY);
        }
    }

    private BillingResult<EscrowRecord> placeHold(UUID escrowId, String bookingId, String payerId,
                                                  String earnerId, long grossAmountMinor) {
        Optional<EscrowEntity> raced = repository.findByBookingId(bookingId);
        if (raced.isPresent()) {
            return replayedHold(raced.get().toDomain(), payerId, earnerId, grossAmountMinor);
        }
        RevenueSplit split = pricingRuleStore.bookingSplit(grossAmountMinor);
        String escrowWallet = ledgerProperties.getEscrowWalletId();
        String related = escrowId.toString();

        List<TransferRequest> legs = new ArrayList<>(2);
        legs.add(TransferRequest.of(legId(escrowId, "hold"), payerId, escrowWallet,
            grossAmountMinor, TransactionKind.BOOKING, related));
        if (split.getPlatformShare() > 0) {
            legs.add(TransferRequest.of(legId(escrowId, "fee"), escrowWallet, ledgerProperties.getPlatformWalletId(),
                split.getPlatformShare(), TransactionKind.FEE, related));
        }

        BillingResult<List<LedgerTransaction>> posted = walletLedger.postTransfers(legs);
        if (posted.isFailure()) {
            return posted.asFailure();
        }

        EscrowRecord escrow = EscrowRecord.hold(escrowId, bookingId, payerId, earnerId,
            grossAmountMinor, split.getPlatformShare(), clock.instant());
        EscrowRecord saved = repository.saveAndFlush(EscrowEntity.fromDomain(escrow)).toDomain();
        outboxService.saveEvent(AGGREGATE_TYPE, EscrowHeldEvent.from(saved));
        return BillingResult.success(saved);
    }

    private BillingResult<EscrowRecord> replayedHold(EscrowRecord existing, String payerId, String earnerId,
                                                     long grossAmountMinor) {
        if (existing.matches(payerId, earnerId, grossAmountMinor)) {
            log.debug("Hold for booking {} replayed, escrow {}", existing.getBookingId(), existing.getEscrowId());
            return BillingResult.success(existing);
        }
        return BillingResult.failure(ErrorCode.IDEMPOTENCY_CONFLICT, String.format(
            "Booking %s is already held with different parameters", existing.getBookingId()));
    }

    // ==================== Resolution ====================

    public BillingResult<EscrowRecord> release(UUID escrowId) {
        return resolveBooking(escrowId, BookingOutcome.release());
    }

    public BillingResult<EscrowRecord> refund(UUID escrowId, BigDecimal fraction) {
        return resolveBooking(escrowId, BookingOutcome.refund(fraction));
    }

    /**
     * Resolves a cancelled booking with the refund its cancellation notice earns.
     */
    public BillingResult<EscrowRecord> cancelBooking(UUID escrowId, CancellationRefundPolicy.CancelledBy cancelledBy,
                                                     Instant bookingStart) {
        if (cancelledBy == null || bookingStart == null) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, "Canceller and booking start are required");
        }
        return resolveBooking(escrowId, refundPolicy.outcomeFor(cancelledBy, bookingStart, clock.instant()));
    }

    /**
     * Applies a release or refund. Applying the same resolution twice returns the resolved
     * escrow; a different resolution of a resolved escrow is INVALID_ESCROW_STATE.
     */
    public BillingResult<EscrowRecord> resolveBooking(UUID escrowId, BookingOutcome outcome) {
        if (escrowId == null || outcome == null) {
            return BillingResult.failure(ErrorCode.INVALID_REQUEST, "Escrow id and outcome are required");
        }
        MDC.put(CorrelationContext.ESCROW_ID_MDC_KEY, escrowId.toString());
        try {
            BillingResult<EscrowRecord> result = concurrencyRetry.execute("escrowResolve",
                () -> transactionTemplate.execute(status -> applyResolution(escrowId, outcome)));
            if (result.isFailure()) {
                log.info("Escrow {} not resolved: {}", escrowId, result.getError());
            }
            return result;
        } finally {
            MDC.remove(CorrelationContext.ESCROW_ID_MDC_KEY);
        }
    }

    private BillingResult<EscrowRecord> applyResolution(UUID escrowId, BookingOutcome outcome) {
        Optional<EscrowEntity> locked = repository.findByIdForUpdate(escrowId);
        if (locked.isEmpty()) {
            return BillingResult.failure(ErrorCode.ESCROW_NOT_FOUND, "Escrow not found: " + escrowId);
        }
        EscrowEntity entity = locked.get();
        EscrowRecord escrow = entity.toDomain();
        long refundMinor = outcome.refundAmount(escrow.getHeldAmountMinor());

        if (!escrow.isHeld()) {
            if (escrow.getRefundedAmountMinor() == refundMinor) {
                log.debug("Escrow {} already resolved as {}, replay ignored", escrowId, escrow.getStatus());
                return BillingResult.success(escrow);
            }
            return BillingResult.failure(ErrorCode.INVALID_ESCROW_STATE, String.format(
                "Escrow %s is already %s", escrowId, escrow.getStatus()));
        }

        EscrowRecord resolved = escrow.resolve(refundMinor, clock.instant());
        String escrowWallet = ledgerProperties.getEscrowWalletId();
        String related = escrowId.toString();

        List<TransferRequest> legs = new ArrayList<>(2);
        if (resolved.getRefundedAmountMinor() > 0) {
            legs.add(TransferRequest.of(legId(escrowId, "refund"), escrowWallet, escrow.getPayerId(),
                resolved.getRefundedAmountMinor(), TransactionKind.REFUND, related));
        }
        if (resolved.getReleasedAmountMinor() > 0) {
            legs.add(TransferRequest.of(legId(escrowId, "release"), escrowWallet, escrow.getEarnerId(),
                resolved.getReleasedAmountMinor(), TransactionKind.BOOKING, related));
        }
        if (!legs.isEmpty()) {
            BillingResult<List<LedgerTransaction>> posted = walletLedger.postTransfers(legs);
            if (posted.isFailure()) {
                return posted.asFailure();
            }
        }

        entity.applyResolution(resolved);
        EscrowRecord saved = repository.saveAndFlush(entity).toDomain();
        outboxService.saveEvent(AGGREGATE_TYPE, EscrowResolvedEvent.from(saved));
        metrics.recordEscrowResolved(saved.getStatus().name());
        log.info("Escrow resolved: status={}, refunded={}, released={}, fee kept={}",
            saved.getStatus(), saved.getRefundedAmountMinor(), saved.getReleasedAmountMinor(), saved.getFeeAmountMinor());
        return BillingResult.success(saved);
    }

    // ==================== Queries ====================

    public Optional<EscrowRecord> getEscrow(UUID escrowId) {
        return repository.findById(escrowId).map(EscrowEntity::toDomain);
    }

    public Optional<EscrowRecord> findByBooking(String bookingId) {
        return repository.findByBookingId(bookingId).map(EscrowEntity::toDomain);
    }

    private static String legId(UUID escrowId, String leg) {
        return "escrow:" + escrowId + ":" + leg;
    }
}
